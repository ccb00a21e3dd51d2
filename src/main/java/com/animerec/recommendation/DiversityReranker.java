package com.animerec.recommendation;

import com.animerec.domain.DomainModels.ItemScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy maximal-marginal-relevance re-ranking: each step picks the pool item maximizing
 * (1 - strength) * score - strength * penalty. Ties keep the incoming order.
 */
public final class DiversityReranker {
    private DiversityReranker() {}

    public static List<ItemScore> rerank(List<ItemScore> ranked, int topN, double strength, int poolFactor, DiversityPenalty penalty) {
        if (strength <= 0.0 || ranked.size() <= 1) return ranked.stream().limit(topN).toList();

        int poolSize = (int) Math.min(ranked.size(), (long) topN * poolFactor);
        List<ItemScore> pool = new ArrayList<>(ranked.subList(0, poolSize));
        List<ItemScore> picked = new ArrayList<>();
        List<Integer> pickedIds = new ArrayList<>();

        while (picked.size() < topN && !pool.isEmpty()) {
            int bestIndex = 0;
            double bestValue = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < pool.size(); i++) {
                ItemScore candidate = pool.get(i);
                double value = (1.0 - strength) * candidate.score() - strength * penalty.penalty(candidate.itemId(), pickedIds);
                if (value > bestValue) {
                    bestValue = value;
                    bestIndex = i;
                }
            }
            ItemScore chosen = pool.remove(bestIndex);
            picked.add(chosen);
            pickedIds.add(chosen.itemId());
        }
        return picked;
    }
}
