package com.animerec.collaborative;

import java.util.List;
import java.util.Map;

public class CollaborativeModels {
    public record UserSimilarity(int userId, double similarity, int overlap) {}

    public record CollaborativePrediction(int userId,
                                          Map<Integer, Double> scores,
                                          CollaborativeSignal signal,
                                          List<UserSimilarity> neighbors,
                                          boolean approximate) {
        public boolean popularityFallback() {
            return signal == CollaborativeSignal.POPULARITY_FALLBACK;
        }
    }

    public enum CollaborativeSignal { PERSONALIZED, POPULARITY_FALLBACK }
}
