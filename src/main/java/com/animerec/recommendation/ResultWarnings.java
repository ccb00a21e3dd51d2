package com.animerec.recommendation;

public final class ResultWarnings {
    public static final String SAMPLING_BUDGET_EXCEEDED = "SAMPLING_BUDGET_EXCEEDED";
    public static final String COLD_START_POPULARITY = "COLD_START_POPULARITY";
    public static final String NO_CONTENT_SEED = "NO_CONTENT_SEED";
    public static final String DIVERSITY_RERANKED = "DIVERSITY_RERANKED";

    private ResultWarnings() {}
}
