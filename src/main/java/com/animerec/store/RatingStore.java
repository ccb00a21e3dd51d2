package com.animerec.store;

import com.animerec.domain.DomainModels.DataIssue;
import com.animerec.domain.DomainModels.Rating;
import com.animerec.domain.DomainModels.UserProfile;
import com.animerec.error.InconsistentDataException;

import java.util.*;

/**
 * Sparse user x item rating matrix. Each user row is stored compressed (item ids ascending with
 * parallel scores); an absent entry means "not rated". Instances are immutable once built.
 */
public final class RatingStore {
    public static final double MIN_SCORE = 1.0;
    public static final double MAX_SCORE = 10.0;

    private final Map<Integer, UserRow> rows;
    private final int[] sortedUserIds;
    private final long ratingCount;

    private RatingStore(Map<Integer, UserRow> rows) {
        this.rows = rows;
        this.sortedUserIds = rows.keySet().stream().mapToInt(Integer::intValue).sorted().toArray();
        this.ratingCount = rows.values().stream().mapToLong(UserRow::size).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RatingStore of(Collection<Rating> ratings) {
        Builder builder = builder();
        ratings.forEach(builder::add);
        return builder.build();
    }

    public static RatingStore empty() {
        return new RatingStore(Map.of());
    }

    public boolean containsUser(int userId) {
        return rows.containsKey(userId);
    }

    public UserRow row(int userId) {
        return rows.getOrDefault(userId, UserRow.EMPTY);
    }

    public int ratingCount(int userId) {
        return row(userId).size();
    }

    public long ratingCount() {
        return ratingCount;
    }

    public int userCount() {
        return sortedUserIds.length;
    }

    public int[] userIds() {
        return sortedUserIds.clone();
    }

    public Set<Integer> itemIds() {
        Set<Integer> items = new TreeSet<>();
        for (UserRow row : rows.values()) {
            for (int item : row.itemIds) items.add(item);
        }
        return items;
    }

    /**
     * Column slice: every user's score for one item, ordered by user id.
     */
    public SortedMap<Integer, Double> column(int itemId) {
        SortedMap<Integer, Double> column = new TreeMap<>();
        for (int userId : sortedUserIds) {
            OptionalDouble score = rows.get(userId).score(itemId);
            if (score.isPresent()) column.put(userId, score.getAsDouble());
        }
        return column;
    }

    public UserProfile profile(int userId) {
        UserRow row = row(userId);
        Map<Integer, Double> ratings = new LinkedHashMap<>();
        for (int i = 0; i < row.size(); i++) {
            ratings.put(row.itemIds[i], row.scores[i]);
        }
        double mean = Arrays.stream(row.scores).average().orElse(0.0);
        double variance = row.size() < 2 ? 0.0
                : Arrays.stream(row.scores).map(s -> (s - mean) * (s - mean)).sum() / (row.size() - 1);
        return new UserProfile(userId, Collections.unmodifiableMap(ratings), mean, Math.sqrt(variance));
    }

    /**
     * Deterministic user sample. The same seed always yields the same permutation, so a smaller
     * budget returns a prefix of a larger one and a sample can be grown incrementally.
     */
    public int[] sampleUsers(int budget, long seed) {
        if (budget >= sortedUserIds.length) return sortedUserIds.clone();
        List<Integer> shuffled = new ArrayList<>(sortedUserIds.length);
        for (int id : sortedUserIds) shuffled.add(id);
        Collections.shuffle(shuffled, new Random(seed));
        int[] sample = shuffled.subList(0, Math.max(budget, 0)).stream().mapToInt(Integer::intValue).toArray();
        Arrays.sort(sample);
        return sample;
    }

    public List<Rating> ratingsOf(int userId) {
        UserRow row = row(userId);
        List<Rating> ratings = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) {
            ratings.add(new Rating(userId, row.itemIds[i], row.scores[i]));
        }
        return ratings;
    }

    public static final class UserRow {
        static final UserRow EMPTY = new UserRow(new int[0], new double[0]);

        private final int[] itemIds;
        private final double[] scores;

        UserRow(int[] itemIds, double[] scores) {
            this.itemIds = itemIds;
            this.scores = scores;
        }

        public int size() {
            return itemIds.length;
        }

        public int itemAt(int index) {
            return itemIds[index];
        }

        public double scoreAt(int index) {
            return scores[index];
        }

        public boolean contains(int itemId) {
            return Arrays.binarySearch(itemIds, itemId) >= 0;
        }

        public OptionalDouble score(int itemId) {
            int idx = Arrays.binarySearch(itemIds, itemId);
            return idx < 0 ? OptionalDouble.empty() : OptionalDouble.of(scores[idx]);
        }
    }

    public static final class Builder {
        private final Map<Integer, Map<Integer, Double>> pending = new HashMap<>();

        private Builder() {}

        public Builder add(Rating rating) {
            return add(rating.userId(), rating.itemId(), rating.score());
        }

        public Builder add(int userId, int itemId, double score) {
            if (Double.isNaN(score) || score < MIN_SCORE || score > MAX_SCORE) {
                throw new InconsistentDataException(new DataIssue("RATING_OUT_OF_RANGE",
                        "Rating " + score + " outside [1,10]", userId + ":" + itemId));
            }
            Double previous = pending.computeIfAbsent(userId, k -> new HashMap<>()).putIfAbsent(itemId, score);
            if (previous != null) {
                throw new InconsistentDataException(new DataIssue("DUPLICATE_RATING",
                        "User rated the same anime twice", userId + ":" + itemId));
            }
            return this;
        }

        public RatingStore build() {
            Map<Integer, UserRow> rows = new HashMap<>(pending.size() * 2);
            pending.forEach((userId, items) -> {
                int[] ids = items.keySet().stream().mapToInt(Integer::intValue).sorted().toArray();
                double[] scores = new double[ids.length];
                for (int i = 0; i < ids.length; i++) scores[i] = items.get(ids[i]);
                rows.put(userId, new UserRow(ids, scores));
            });
            return new RatingStore(Collections.unmodifiableMap(rows));
        }
    }
}
