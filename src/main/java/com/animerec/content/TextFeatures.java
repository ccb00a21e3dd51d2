package com.animerec.content;

import com.animerec.domain.DomainModels.AnimeRecord;

import java.util.*;
import java.util.regex.Pattern;

public final class TextFeatures {
    private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "after", "again", "against", "all", "an", "and", "any", "are", "as", "at",
            "be", "because", "been", "before", "being", "between", "both", "but", "by", "can", "could",
            "did", "do", "does", "doing", "during", "each", "for", "from", "further", "had", "has", "have",
            "having", "he", "her", "here", "hers", "herself", "him", "himself", "his", "how", "if", "in",
            "into", "is", "it", "its", "itself", "just", "me", "more", "most", "my", "myself", "no", "nor",
            "not", "now", "of", "off", "on", "once", "only", "or", "other", "our", "ours", "out", "over",
            "own", "same", "she", "should", "so", "some", "such", "than", "that", "the", "their", "theirs",
            "them", "then", "there", "these", "they", "this", "those", "through", "to", "too", "under",
            "until", "up", "very", "was", "we", "were", "what", "when", "where", "which", "while", "who",
            "whom", "why", "will", "with", "would", "you", "your", "yours", "s", "t");

    private TextFeatures() {}

    /**
     * Genre tags followed by the synopsis, as one feature document.
     */
    public static String document(AnimeRecord record) {
        String genres = String.join(" ", new TreeSet<>(record.genres()));
        return (genres + " " + record.synopsis()).trim();
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        List<String> tokens = new ArrayList<>();
        for (String raw : SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.isEmpty() || STOP_WORDS.contains(raw)) continue;
            tokens.add(raw);
        }
        return tokens;
    }
}
