package com.animerec.config;

import com.animerec.config.RecommenderProperties.AlphaFormula;
import com.animerec.config.RecommenderProperties.DiversityPenaltyType;

import java.util.Objects;

public record RecommenderSettings(int neighborK,
                                  int userSampleBudget,
                                  int minRatingsForPersonalization,
                                  long samplingSeed,
                                  boolean unknownUserFallback,
                                  AlphaSettings alpha,
                                  DiversitySettings diversity,
                                  int maxFeatures,
                                  int defaultTopN,
                                  int maxTopN) {

    public RecommenderSettings {
        require(neighborK > 0, "neighbor-k must be positive");
        require(userSampleBudget > 0, "user-sample-budget must be positive");
        require(minRatingsForPersonalization >= 0, "min-ratings-for-personalization must not be negative");
        require(maxFeatures >= 0, "content.max-features must not be negative");
        require(defaultTopN > 0 && maxTopN >= defaultTopN, "top-n bounds are inconsistent");
        Objects.requireNonNull(alpha, "alpha");
        Objects.requireNonNull(diversity, "diversity");
    }

    public static RecommenderSettings defaults() {
        return new RecommenderProperties().toSettings();
    }

    public RecommenderSettings withNeighborK(int k) {
        return new RecommenderSettings(k, userSampleBudget, minRatingsForPersonalization, samplingSeed,
                unknownUserFallback, alpha, diversity, maxFeatures, defaultTopN, maxTopN);
    }

    public RecommenderSettings withUserSampleBudget(int budget) {
        return new RecommenderSettings(neighborK, budget, minRatingsForPersonalization, samplingSeed,
                unknownUserFallback, alpha, diversity, maxFeatures, defaultTopN, maxTopN);
    }

    public RecommenderSettings withMinRatingsForPersonalization(int minRatings) {
        return new RecommenderSettings(neighborK, userSampleBudget, minRatings, samplingSeed,
                unknownUserFallback, alpha, diversity, maxFeatures, defaultTopN, maxTopN);
    }

    public RecommenderSettings withUnknownUserFallback(boolean fallback) {
        return new RecommenderSettings(neighborK, userSampleBudget, minRatingsForPersonalization, samplingSeed,
                fallback, alpha, diversity, maxFeatures, defaultTopN, maxTopN);
    }

    public RecommenderSettings withDiversity(DiversitySettings newDiversity) {
        return new RecommenderSettings(neighborK, userSampleBudget, minRatingsForPersonalization, samplingSeed,
                unknownUserFallback, alpha, newDiversity, maxFeatures, defaultTopN, maxTopN);
    }

    public RecommenderSettings withAlpha(AlphaSettings newAlpha) {
        return new RecommenderSettings(neighborK, userSampleBudget, minRatingsForPersonalization, samplingSeed,
                unknownUserFallback, newAlpha, diversity, maxFeatures, defaultTopN, maxTopN);
    }

    public record AlphaSettings(AlphaFormula formula, double min, double max, double halfSaturation, int fullWeightAt, double fixed) {
        public AlphaSettings {
            Objects.requireNonNull(formula, "alpha.formula");
            require(min >= 0.0 && max <= 1.0 && min <= max, "alpha.min/alpha.max must satisfy 0 <= min <= max <= 1");
            require(halfSaturation > 0.0, "alpha.half-saturation must be positive");
            require(fullWeightAt > 0, "alpha.full-weight-at must be positive");
            require(fixed >= 0.0 && fixed <= 1.0, "alpha.fixed must be within [0,1]");
        }
    }

    public record DiversitySettings(double strength, DiversityPenaltyType penalty, int poolFactor) {
        public DiversitySettings {
            require(strength >= 0.0 && strength <= 1.0, "diversity.strength must be within [0,1]");
            Objects.requireNonNull(penalty, "diversity.penalty");
            require(poolFactor >= 1, "diversity.pool-factor must be at least 1");
        }

        public boolean enabled() {
            return strength > 0.0;
        }
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new IllegalArgumentException(message);
    }
}
