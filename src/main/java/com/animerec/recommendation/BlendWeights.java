package com.animerec.recommendation;

import com.animerec.config.RecommenderSettings.AlphaSettings;

public final class BlendWeights {
    private BlendWeights() {}

    public static BlendWeightFunction from(AlphaSettings settings) {
        return switch (settings.formula()) {
            case SATURATING -> saturating(settings.min(), settings.max(), settings.halfSaturation());
            case LINEAR -> linear(settings.min(), settings.max(), settings.fullWeightAt());
            case FIXED -> fixed(settings.fixed());
            case RATING_SPREAD -> ratingSpread();
        };
    }

    /**
     * min + (max - min) * n / (n + halfSaturation): half-way between min and max at n = halfSaturation ratings.
     */
    public static BlendWeightFunction saturating(double min, double max, double halfSaturation) {
        return profile -> {
            double n = profile.ratingCount();
            return clamp(min + (max - min) * n / (n + halfSaturation));
        };
    }

    public static BlendWeightFunction linear(double min, double max, int fullWeightAt) {
        return profile -> clamp(min + (max - min) * Math.min(1.0, profile.ratingCount() / (double) fullWeightAt));
    }

    public static BlendWeightFunction fixed(double alpha) {
        double value = clamp(alpha);
        return profile -> value;
    }

    /**
     * Consistent raters lean on content, raters with a wide spread lean on collaborative signal.
     */
    public static BlendWeightFunction ratingSpread() {
        return profile -> {
            if (profile.ratingCount() < 2) return 0.6;
            if (profile.ratingStdDev() < 1.0) return 0.3;
            if (profile.ratingStdDev() > 2.0) return 0.8;
            return 0.6;
        };
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
