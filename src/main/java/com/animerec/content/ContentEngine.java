package com.animerec.content;

import com.animerec.domain.DomainModels.ItemScore;
import com.animerec.domain.DomainModels.UserProfile;
import com.animerec.error.EmptyCatalogException;
import com.animerec.error.EmptySeedException;
import com.animerec.error.UnknownItemException;
import com.animerec.recommendation.EngineSnapshot;
import com.animerec.recommendation.RecommendationMode;
import com.animerec.recommendation.RecommendationModels;
import com.animerec.recommendation.RecommendationStrategy;
import com.animerec.recommendation.ScoreFactors;
import com.animerec.store.AnimeCatalog;
import com.animerec.store.RatingStore;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class ContentEngine implements RecommendationStrategy {

    @Override
    public RecommendationMode mode() {
        return RecommendationMode.CONTENT;
    }

    @Override
    public String description() {
        return "Content-based filtering: TF-IDF similarity of genres and synopsis to the anime a user rated";
    }

    /**
     * Weighted sum of each seed's similarity to every non-excluded catalog item, ranked.
     */
    public Map<Integer, Double> similarItems(EngineSnapshot snapshot, Map<Integer, Double> seedWeights, Set<Integer> excluded) {
        AnimeCatalog catalog = snapshot.catalog();
        if (catalog.isEmpty()) throw new EmptyCatalogException();
        if (seedWeights.isEmpty()) throw new EmptySeedException();

        TfIdfIndex index = snapshot.tfIdf();
        double[] totals = new double[catalog.size()];
        List<Integer> seeds = seedWeights.keySet().stream().sorted().toList();
        for (Integer seed : seeds) {
            int position = catalog.position(seed);
            if (position < 0) throw new UnknownItemException(seed);
            double weight = seedWeights.get(seed);
            double[] similarities = index.similarities(position);
            for (int j = 0; j < totals.length; j++) {
                totals[j] += weight * similarities[j];
            }
        }

        Map<Integer, Double> scores = new HashMap<>();
        for (int j = 0; j < totals.length; j++) {
            int itemId = catalog.at(j).itemId();
            if (!excluded.contains(itemId)) scores.put(itemId, totals[j]);
        }
        Map<Integer, Double> ranked = new LinkedHashMap<>();
        catalog.rank(scores).forEach(s -> ranked.put(s.itemId(), s.score()));
        return ranked;
    }

    /**
     * Content scores for a user's unseen items, seeded by every rated item weighted rating / 10.
     */
    public Map<Integer, Double> scoreForUser(EngineSnapshot snapshot, int userId) {
        RatingStore ratings = snapshot.ratings();
        UserProfile profile = ratings.profile(userId);
        if (profile.ratingCount() == 0) throw new EmptySeedException(userId);

        Map<Integer, Double> seeds = new HashMap<>();
        profile.ratings().forEach((item, rating) -> seeds.put(item, rating / RatingStore.MAX_SCORE));
        return similarItems(snapshot, seeds, profile.ratedItems());
    }

    public List<ItemScore> similarTo(EngineSnapshot snapshot, int itemId, int topN) {
        if (!snapshot.catalog().contains(itemId)) throw new UnknownItemException(itemId);
        return similarItems(snapshot, Map.of(itemId, 1.0), Set.of(itemId)).entrySet().stream()
                .limit(topN)
                .map(e -> new ItemScore(e.getKey(), e.getValue()))
                .toList();
    }

    @Override
    public RecommendationModels.RecommendationResult recommend(EngineSnapshot snapshot, int userId, int topN) {
        List<RecommendationModels.RecommendedItem> items = scoreForUser(snapshot, userId).entrySet().stream()
                .limit(topN)
                .map(e -> new RecommendationModels.RecommendedItem(e.getKey(), snapshot.title(e.getKey()), e.getValue(),
                        List.of(new RecommendationModels.FactorScore(ScoreFactors.CONTENT, e.getValue()))))
                .toList();
        return new RecommendationModels.RecommendationResult(userId, mode(), items, 0.0, false, false, List.of(), snapshot.version());
    }
}
