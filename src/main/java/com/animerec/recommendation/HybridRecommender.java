package com.animerec.recommendation;

import com.animerec.collaborative.CollaborativeEngine;
import com.animerec.collaborative.CollaborativeModels.CollaborativePrediction;
import com.animerec.config.RecommenderSettings;
import com.animerec.content.ContentEngine;
import com.animerec.domain.DomainModels.ItemScore;
import com.animerec.domain.DomainModels.UserProfile;
import com.animerec.error.EmptySeedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class HybridRecommender implements RecommendationStrategy {
    private static final Logger log = LoggerFactory.getLogger(HybridRecommender.class);

    private final CollaborativeEngine collaborativeEngine;
    private final ContentEngine contentEngine;

    public HybridRecommender(CollaborativeEngine collaborativeEngine, ContentEngine contentEngine) {
        this.collaborativeEngine = collaborativeEngine;
        this.contentEngine = contentEngine;
    }

    @Override
    public RecommendationMode mode() {
        return RecommendationMode.HYBRID;
    }

    @Override
    public String description() {
        return "Hybrid: normalized collaborative and content scores blended by the user's rating density";
    }

    @Override
    public RecommendationModels.RecommendationResult recommend(EngineSnapshot snapshot, int userId, int topN) {
        RecommenderSettings settings = snapshot.settings();
        UserProfile profile = snapshot.ratings().profile(userId);
        List<Integer> candidates = snapshot.candidatesFor(userId);
        List<String> warnings = new ArrayList<>();

        CollaborativePrediction collaborative = collaborativeEngine.predict(snapshot, userId, candidates);
        if (collaborative.popularityFallback()) warnings.add(ResultWarnings.COLD_START_POPULARITY);
        if (collaborative.approximate()) warnings.add(ResultWarnings.SAMPLING_BUDGET_EXCEEDED);

        Map<Integer, Double> content;
        try {
            content = contentEngine.scoreForUser(snapshot, userId);
        } catch (EmptySeedException e) {
            log.debug("No content seed for user {}, blending collaborative scores only", userId);
            warnings.add(ResultWarnings.NO_CONTENT_SEED);
            content = Map.of();
        }

        double alpha = BlendWeights.from(settings.alpha()).alpha(profile);
        Map<Integer, Double> collaborativeNorm = normalize(collaborative.scores());
        Map<Integer, Double> contentNorm = normalize(content);
        String collaborativeFactor = collaborative.popularityFallback() ? ScoreFactors.POPULARITY : ScoreFactors.COLLABORATIVE;

        Map<Integer, Double> blended = new HashMap<>();
        Map<Integer, List<RecommendationModels.FactorScore>> factors = new HashMap<>();
        for (Integer item : candidates) {
            Double c = collaborativeNorm.get(item);
            Double t = contentNorm.get(item);
            if (c == null && t == null) continue;
            blended.put(item, blend(alpha, c == null ? 0.0 : c, t == null ? 0.0 : t));

            List<RecommendationModels.FactorScore> breakdown = new ArrayList<>(2);
            if (c != null) breakdown.add(new RecommendationModels.FactorScore(collaborativeFactor, c));
            if (t != null) breakdown.add(new RecommendationModels.FactorScore(ScoreFactors.CONTENT, t));
            factors.put(item, List.copyOf(breakdown));
        }

        List<ItemScore> ranked = snapshot.catalog().rank(blended);
        RecommenderSettings.DiversitySettings diversity = settings.diversity();
        if (diversity.enabled()) {
            ranked = DiversityReranker.rerank(ranked, topN, diversity.strength(), diversity.poolFactor(),
                    DiversityPenalties.of(diversity.penalty(), snapshot));
            warnings.add(ResultWarnings.DIVERSITY_RERANKED);
        }

        List<RecommendationModels.RecommendedItem> items = ranked.stream()
                .limit(topN)
                .map(s -> new RecommendationModels.RecommendedItem(s.itemId(), snapshot.title(s.itemId()), s.score(), factors.get(s.itemId())))
                .toList();

        return new RecommendationModels.RecommendationResult(userId, mode(), items, alpha,
                collaborative.popularityFallback(), collaborative.approximate(), List.copyOf(warnings), snapshot.version());
    }

    public static double blend(double alpha, double collaborativeNorm, double contentNorm) {
        return alpha * collaborativeNorm + (1.0 - alpha) * contentNorm;
    }

    /**
     * Min-max to [0,1]. A flat distribution maps positive scores to 1 and zero scores to 0.
     */
    public static Map<Integer, Double> normalize(Map<Integer, Double> scores) {
        if (scores.isEmpty()) return Map.of();
        double min = scores.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double range = max - min;
        Map<Integer, Double> normalized = new HashMap<>(scores.size() * 2);
        scores.forEach((item, score) -> {
            if (range == 0.0) {
                normalized.put(item, score > 0.0 ? 1.0 : 0.0);
            } else {
                normalized.put(item, (score - min) / range);
            }
        });
        return normalized;
    }
}
