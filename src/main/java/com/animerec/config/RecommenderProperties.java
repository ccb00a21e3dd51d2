package com.animerec.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Bound from {@code recommender.*}. Converted into {@link RecommenderSettings} whenever caches are built.
 */
@ConfigurationProperties(prefix = "recommender")
public class RecommenderProperties {

    private int neighborK = 30;
    private int userSampleBudget = 10_000;
    private int minRatingsForPersonalization = 5;
    private long samplingSeed = 42L;
    private boolean unknownUserFallback = true;
    private int defaultTopN = 10;
    private int maxTopN = 100;

    @NestedConfigurationProperty
    private Alpha alpha = new Alpha();

    @NestedConfigurationProperty
    private Diversity diversity = new Diversity();

    @NestedConfigurationProperty
    private Content content = new Content();

    @NestedConfigurationProperty
    private Refresh refresh = new Refresh();

    public RecommenderSettings toSettings() {
        return new RecommenderSettings(
                neighborK,
                userSampleBudget,
                minRatingsForPersonalization,
                samplingSeed,
                unknownUserFallback,
                new RecommenderSettings.AlphaSettings(alpha.getFormula(), alpha.getMin(), alpha.getMax(),
                        alpha.getHalfSaturation(), alpha.getFullWeightAt(), alpha.getFixed()),
                new RecommenderSettings.DiversitySettings(diversity.getStrength(), diversity.getPenalty(), diversity.getPoolFactor()),
                content.getMaxFeatures(),
                defaultTopN,
                maxTopN);
    }

    public int getNeighborK() { return neighborK; }
    public void setNeighborK(int neighborK) { this.neighborK = neighborK; }

    public int getUserSampleBudget() { return userSampleBudget; }
    public void setUserSampleBudget(int userSampleBudget) { this.userSampleBudget = userSampleBudget; }

    public int getMinRatingsForPersonalization() { return minRatingsForPersonalization; }
    public void setMinRatingsForPersonalization(int minRatingsForPersonalization) { this.minRatingsForPersonalization = minRatingsForPersonalization; }

    public long getSamplingSeed() { return samplingSeed; }
    public void setSamplingSeed(long samplingSeed) { this.samplingSeed = samplingSeed; }

    public boolean isUnknownUserFallback() { return unknownUserFallback; }
    public void setUnknownUserFallback(boolean unknownUserFallback) { this.unknownUserFallback = unknownUserFallback; }

    public int getDefaultTopN() { return defaultTopN; }
    public void setDefaultTopN(int defaultTopN) { this.defaultTopN = defaultTopN; }

    public int getMaxTopN() { return maxTopN; }
    public void setMaxTopN(int maxTopN) { this.maxTopN = maxTopN; }

    public Alpha getAlpha() { return alpha; }
    public void setAlpha(Alpha alpha) { this.alpha = alpha; }

    public Diversity getDiversity() { return diversity; }
    public void setDiversity(Diversity diversity) { this.diversity = diversity; }

    public Content getContent() { return content; }
    public void setContent(Content content) { this.content = content; }

    public Refresh getRefresh() { return refresh; }
    public void setRefresh(Refresh refresh) { this.refresh = refresh; }

    public static class Alpha {
        private AlphaFormula formula = AlphaFormula.SATURATING;
        private double min = 0.2;
        private double max = 0.9;
        private double halfSaturation = 50.0;
        private int fullWeightAt = 200;
        private double fixed = 0.6;

        public AlphaFormula getFormula() { return formula; }
        public void setFormula(AlphaFormula formula) { this.formula = formula; }

        public double getMin() { return min; }
        public void setMin(double min) { this.min = min; }

        public double getMax() { return max; }
        public void setMax(double max) { this.max = max; }

        public double getHalfSaturation() { return halfSaturation; }
        public void setHalfSaturation(double halfSaturation) { this.halfSaturation = halfSaturation; }

        public int getFullWeightAt() { return fullWeightAt; }
        public void setFullWeightAt(int fullWeightAt) { this.fullWeightAt = fullWeightAt; }

        public double getFixed() { return fixed; }
        public void setFixed(double fixed) { this.fixed = fixed; }
    }

    public static class Diversity {
        private double strength = 0.0;
        private DiversityPenaltyType penalty = DiversityPenaltyType.GENRE_OVERLAP;
        private int poolFactor = 3;

        public double getStrength() { return strength; }
        public void setStrength(double strength) { this.strength = strength; }

        public DiversityPenaltyType getPenalty() { return penalty; }
        public void setPenalty(DiversityPenaltyType penalty) { this.penalty = penalty; }

        public int getPoolFactor() { return poolFactor; }
        public void setPoolFactor(int poolFactor) { this.poolFactor = poolFactor; }
    }

    public static class Content {
        private int maxFeatures = 0;

        public int getMaxFeatures() { return maxFeatures; }
        public void setMaxFeatures(int maxFeatures) { this.maxFeatures = maxFeatures; }
    }

    public static class Refresh {
        private boolean enabled = false;
        private long fixedDelayMs = 3_600_000L;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getFixedDelayMs() { return fixedDelayMs; }
        public void setFixedDelayMs(long fixedDelayMs) { this.fixedDelayMs = fixedDelayMs; }
    }

    public enum AlphaFormula { SATURATING, LINEAR, FIXED, RATING_SPREAD }

    public enum DiversityPenaltyType { GENRE_OVERLAP, CONTENT_SIMILARITY }
}
