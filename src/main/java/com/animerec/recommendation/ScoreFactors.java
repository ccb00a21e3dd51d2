package com.animerec.recommendation;

public final class ScoreFactors {
    public static final String COLLABORATIVE = "collaborative";
    public static final String CONTENT = "content";
    public static final String POPULARITY = "popularity";

    private ScoreFactors() {}
}
