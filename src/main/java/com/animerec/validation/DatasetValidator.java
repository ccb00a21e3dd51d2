package com.animerec.validation;

import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.domain.DomainModels.DataIssue;
import com.animerec.store.RatingStore;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class DatasetValidator {
    public List<DataIssue> validate(List<AnimeRecord> records, RatingStore ratings) {
        List<DataIssue> issues = new ArrayList<>();

        Map<Integer, Long> counts = records.stream().collect(Collectors.groupingBy(AnimeRecord::itemId, Collectors.counting()));
        counts.forEach((id, count) -> {
            if (count > 1) {
                issues.add(new DataIssue("DUPLICATE_ANIME", "Anime id appears " + count + " times", String.valueOf(id)));
            }
        });

        records.forEach(r -> {
            if (r.popularityCount() < 0) {
                issues.add(new DataIssue("NEGATIVE_POPULARITY", "Popularity count must not be negative: " + r.popularityCount(), String.valueOf(r.itemId())));
            }
            if (Double.isNaN(r.meanScore()) || r.meanScore() < 0.0 || r.meanScore() > RatingStore.MAX_SCORE) {
                issues.add(new DataIssue("MEAN_SCORE_OUT_OF_RANGE", "Mean score outside [0,10]: " + r.meanScore(), String.valueOf(r.itemId())));
            }
        });

        Set<Integer> known = counts.keySet();
        ratings.itemIds().stream()
                .filter(item -> !known.contains(item))
                .forEach(item -> issues.add(new DataIssue("UNKNOWN_ANIME_REFERENCE",
                        "Ratings reference anime absent from metadata", String.valueOf(item))));

        return issues;
    }
}
