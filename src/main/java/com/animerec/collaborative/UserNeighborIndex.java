package com.animerec.collaborative;

import com.animerec.store.RatingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Candidate pool for neighbor search: every user while the population fits the sampling budget,
 * otherwise a seeded sample of it. Immutable, one per cache version.
 */
public final class UserNeighborIndex {
    private static final Logger log = LoggerFactory.getLogger(UserNeighborIndex.class);

    private final int[] pool;
    private final int population;
    private final boolean approximate;

    private UserNeighborIndex(int[] pool, int population, boolean approximate) {
        this.pool = pool;
        this.population = population;
        this.approximate = approximate;
    }

    public static UserNeighborIndex build(RatingStore ratings, int sampleBudget, long seed) {
        int population = ratings.userCount();
        if (population <= sampleBudget) {
            return new UserNeighborIndex(ratings.userIds(), population, false);
        }
        int[] sample = ratings.sampleUsers(sampleBudget, seed);
        log.warn("User population {} exceeds sampling budget {}, neighbor search uses a seeded sample (seed={})",
                population, sampleBudget, seed);
        return new UserNeighborIndex(sample, population, true);
    }

    /**
     * Pool for one target user; the target is always part of it even when the sample missed it.
     */
    public int[] candidatePool(int targetUserId) {
        if (Arrays.binarySearch(pool, targetUserId) >= 0) return pool;
        int[] withTarget = Arrays.copyOf(pool, pool.length + 1);
        withTarget[pool.length] = targetUserId;
        Arrays.sort(withTarget);
        return withTarget;
    }

    public int poolSize() {
        return pool.length;
    }

    public int population() {
        return population;
    }

    public boolean approximate() {
        return approximate;
    }
}
