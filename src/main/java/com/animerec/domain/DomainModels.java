package com.animerec.domain;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class DomainModels {
    public record Rating(int userId, int itemId, double score) {}

    public record AnimeRecord(int itemId,
                              String title,
                              Set<String> genres,
                              String synopsis,
                              double meanScore,
                              int popularityCount) {
        public AnimeRecord {
            genres = genres == null ? Set.of() : Set.copyOf(genres);
            synopsis = synopsis == null ? "" : synopsis;
            title = title == null ? "" : title;
        }
    }

    public record UserProfile(int userId, Map<Integer, Double> ratings, double meanRating, double ratingStdDev) {
        public int ratingCount() {
            return ratings.size();
        }

        public Set<Integer> ratedItems() {
            return ratings.keySet();
        }
    }

    public record DataIssue(String code, String message, String ref) {}

    public record StrategyInfo(String mode, String description) {}

    public record ItemScore(int itemId, double score) {}

    public record UserRatings(int userId, List<Rating> ratings) {}
}
