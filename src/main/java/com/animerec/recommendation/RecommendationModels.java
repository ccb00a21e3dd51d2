package com.animerec.recommendation;

import java.util.List;
import java.util.OptionalDouble;

public class RecommendationModels {
    public record RecommendationResult(int userId,
                                       RecommendationMode mode,
                                       List<RecommendedItem> items,
                                       double alpha,
                                       boolean coldStartFallback,
                                       boolean approximate,
                                       List<String> warnings,
                                       long cacheVersion) {}

    public record RecommendedItem(int itemId, String title, double score, List<FactorScore> factors) {
        public OptionalDouble factor(String name) {
            return factors.stream()
                    .filter(f -> f.name().equals(name))
                    .mapToDouble(FactorScore::value)
                    .findFirst();
        }
    }

    public record FactorScore(String name, double value) {}

    public record SimilarItem(int itemId, String title, double score) {}

    public record CacheStatus(long version,
                              boolean built,
                              int users,
                              int items,
                              long ratings,
                              boolean approximate,
                              int vocabularySize) {}
}
