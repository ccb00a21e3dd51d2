package com.animerec.recommendation;

import com.animerec.recommendation.RecommendationModels.RecommendationResult;

/**
 * One way of scoring a user's unseen catalog items. Implementations are stateless and read only
 * from the snapshot they are handed.
 */
public interface RecommendationStrategy {
    RecommendationMode mode();

    String description();

    RecommendationResult recommend(EngineSnapshot snapshot, int userId, int topN);
}
