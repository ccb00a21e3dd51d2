package com.animerec.collaborative;

import com.animerec.collaborative.CollaborativeModels.CollaborativePrediction;
import com.animerec.collaborative.CollaborativeModels.CollaborativeSignal;
import com.animerec.collaborative.CollaborativeModels.UserSimilarity;
import com.animerec.config.RecommenderSettings;
import com.animerec.domain.DomainModels.ItemScore;
import com.animerec.error.UnknownUserException;
import com.animerec.recommendation.EngineSnapshot;
import com.animerec.recommendation.RecommendationMode;
import com.animerec.recommendation.RecommendationModels;
import com.animerec.recommendation.RecommendationStrategy;
import com.animerec.recommendation.ResultWarnings;
import com.animerec.recommendation.ScoreFactors;
import com.animerec.store.RatingStore;
import com.animerec.store.RatingStore.UserRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class CollaborativeEngine implements RecommendationStrategy {
    private static final Logger log = LoggerFactory.getLogger(CollaborativeEngine.class);

    static final Comparator<UserSimilarity> NEIGHBOR_ORDER = Comparator
            .comparingDouble(UserSimilarity::similarity).reversed()
            .thenComparing(Comparator.comparingInt(UserSimilarity::overlap).reversed())
            .thenComparingInt(UserSimilarity::userId);

    @Override
    public RecommendationMode mode() {
        return RecommendationMode.COLLABORATIVE;
    }

    @Override
    public String description() {
        return "User-based collaborative filtering: weighted ratings of the most similar users";
    }

    public CollaborativePrediction predict(EngineSnapshot snapshot, int userId, Collection<Integer> candidateItems) {
        RecommenderSettings settings = snapshot.settings();
        RatingStore ratings = snapshot.ratings();

        if (!ratings.containsUser(userId) && !settings.unknownUserFallback()) {
            throw new UnknownUserException(userId);
        }
        if (ratings.ratingCount(userId) < settings.minRatingsForPersonalization()) {
            log.debug("User {} has {} ratings (< {}), using popularity fallback",
                    userId, ratings.ratingCount(userId), settings.minRatingsForPersonalization());
            Map<Integer, Double> scores = new LinkedHashMap<>();
            for (Integer item : candidateItems) {
                if (snapshot.catalog().contains(item)) scores.put(item, snapshot.catalog().popularityScore(item));
            }
            return new CollaborativePrediction(userId, scores, CollaborativeSignal.POPULARITY_FALLBACK, List.of(), false);
        }

        List<UserSimilarity> neighbors = neighbors(snapshot, userId);
        Map<Integer, Double> scores = new LinkedHashMap<>();
        for (Integer item : candidateItems) {
            double weighted = 0.0;
            double weights = 0.0;
            for (UserSimilarity neighbor : neighbors) {
                OptionalDouble rating = ratings.row(neighbor.userId()).score(item);
                if (rating.isEmpty()) continue;
                double w = Math.max(0.0, neighbor.similarity());
                weighted += w * rating.getAsDouble();
                weights += w;
            }
            if (weights > 0.0) scores.put(item, weighted / weights);
        }
        return new CollaborativePrediction(userId, scores, CollaborativeSignal.PERSONALIZED, neighbors,
                snapshot.neighborIndex().approximate());
    }

    /**
     * Top-K users with positive similarity to the target, ordered by similarity, then overlap, then user id.
     */
    public List<UserSimilarity> neighbors(EngineSnapshot snapshot, int userId) {
        RatingStore ratings = snapshot.ratings();
        UserRow target = ratings.row(userId);
        int[] pool = snapshot.neighborIndex().candidatePool(userId);
        return Arrays.stream(pool)
                .parallel()
                .filter(other -> other != userId)
                .mapToObj(other -> similarity(other, target, ratings.row(other)))
                .filter(s -> s.similarity() > 0.0)
                .sorted(NEIGHBOR_ORDER)
                .limit(snapshot.settings().neighborK())
                .toList();
    }

    /**
     * Cosine similarity restricted to the items both users rated; 0 when they share none.
     */
    public static double similarity(UserRow a, UserRow b) {
        return similarity(-1, a, b).similarity();
    }

    private static UserSimilarity similarity(int otherUserId, UserRow a, UserRow b) {
        int i = 0;
        int j = 0;
        int overlap = 0;
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        while (i < a.size() && j < b.size()) {
            int itemA = a.itemAt(i);
            int itemB = b.itemAt(j);
            if (itemA == itemB) {
                double x = a.scoreAt(i);
                double y = b.scoreAt(j);
                dot += x * y;
                normA += x * x;
                normB += y * y;
                overlap++;
                i++;
                j++;
            } else if (itemA < itemB) {
                i++;
            } else {
                j++;
            }
        }
        if (overlap == 0 || normA == 0.0 || normB == 0.0) return new UserSimilarity(otherUserId, 0.0, overlap);
        return new UserSimilarity(otherUserId, Math.min(1.0, dot / Math.sqrt(normA * normB)), overlap);
    }

    @Override
    public RecommendationModels.RecommendationResult recommend(EngineSnapshot snapshot, int userId, int topN) {
        CollaborativePrediction prediction = predict(snapshot, userId, snapshot.candidatesFor(userId));
        String factor = prediction.popularityFallback() ? ScoreFactors.POPULARITY : ScoreFactors.COLLABORATIVE;

        List<RecommendationModels.RecommendedItem> items = snapshot.catalog().rank(prediction.scores()).stream()
                .limit(topN)
                .map(s -> toItem(snapshot, s, factor))
                .toList();

        List<String> warnings = new ArrayList<>();
        if (prediction.popularityFallback()) warnings.add(ResultWarnings.COLD_START_POPULARITY);
        if (prediction.approximate()) warnings.add(ResultWarnings.SAMPLING_BUDGET_EXCEEDED);
        return new RecommendationModels.RecommendationResult(userId, mode(), items, 1.0,
                prediction.popularityFallback(), prediction.approximate(), List.copyOf(warnings), snapshot.version());
    }

    private RecommendationModels.RecommendedItem toItem(EngineSnapshot snapshot, ItemScore score, String factor) {
        return new RecommendationModels.RecommendedItem(score.itemId(), snapshot.title(score.itemId()), score.score(),
                List.of(new RecommendationModels.FactorScore(factor, score.score())));
    }
}
