package com.animerec.recommendation;

import com.animerec.config.RecommenderProperties.DiversityPenaltyType;
import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.store.AnimeCatalog;
import com.animerec.content.TfIdfIndex;

import java.util.HashSet;
import java.util.Set;

public final class DiversityPenalties {
    private DiversityPenalties() {}

    public static DiversityPenalty of(DiversityPenaltyType type, EngineSnapshot snapshot) {
        return switch (type) {
            case GENRE_OVERLAP -> genreOverlap(snapshot.catalog());
            case CONTENT_SIMILARITY -> contentSimilarity(snapshot.catalog(), snapshot.tfIdf());
        };
    }

    /**
     * Largest genre Jaccard overlap with any selected item.
     */
    public static DiversityPenalty genreOverlap(AnimeCatalog catalog) {
        return (candidate, selected) -> {
            Set<String> genres = catalog.find(candidate).map(AnimeRecord::genres).orElse(Set.of());
            if (genres.isEmpty()) return 0.0;
            double worst = 0.0;
            for (Integer other : selected) {
                Set<String> otherGenres = catalog.find(other).map(AnimeRecord::genres).orElse(Set.of());
                if (otherGenres.isEmpty()) continue;
                Set<String> shared = new HashSet<>(genres);
                shared.retainAll(otherGenres);
                Set<String> union = new HashSet<>(genres);
                union.addAll(otherGenres);
                worst = Math.max(worst, shared.size() / (double) union.size());
            }
            return worst;
        };
    }

    public static DiversityPenalty contentSimilarity(AnimeCatalog catalog, TfIdfIndex index) {
        return (candidate, selected) -> {
            int position = catalog.position(candidate);
            if (position < 0) return 0.0;
            double worst = 0.0;
            for (Integer other : selected) {
                int otherPosition = catalog.position(other);
                if (otherPosition >= 0) worst = Math.max(worst, index.similarity(position, otherPosition));
            }
            return worst;
        };
    }
}
