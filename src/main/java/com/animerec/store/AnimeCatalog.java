package com.animerec.store;

import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.domain.DomainModels.ItemScore;

import java.util.*;

public final class AnimeCatalog {
    private final List<AnimeRecord> records;
    private final Map<Integer, Integer> positions;

    private AnimeCatalog(List<AnimeRecord> records) {
        this.records = records;
        Map<Integer, Integer> index = new HashMap<>(records.size() * 2);
        for (int i = 0; i < records.size(); i++) {
            index.put(records.get(i).itemId(), i);
        }
        this.positions = Collections.unmodifiableMap(index);
    }

    /**
     * Records are ordered by item id; a later duplicate id is expected to be rejected before this point.
     */
    public static AnimeCatalog of(Collection<AnimeRecord> records) {
        List<AnimeRecord> sorted = records.stream()
                .sorted(Comparator.comparingInt(AnimeRecord::itemId))
                .toList();
        return new AnimeCatalog(sorted);
    }

    public static AnimeCatalog empty() {
        return new AnimeCatalog(List.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    public boolean contains(int itemId) {
        return positions.containsKey(itemId);
    }

    public Optional<AnimeRecord> find(int itemId) {
        Integer pos = positions.get(itemId);
        return pos == null ? Optional.empty() : Optional.of(records.get(pos));
    }

    public int position(int itemId) {
        Integer pos = positions.get(itemId);
        return pos == null ? -1 : pos;
    }

    public AnimeRecord at(int position) {
        return records.get(position);
    }

    public List<AnimeRecord> records() {
        return records;
    }

    public List<Integer> itemIds() {
        return records.stream().map(AnimeRecord::itemId).toList();
    }

    public int popularityCount(int itemId) {
        return find(itemId).map(AnimeRecord::popularityCount).orElse(0);
    }

    public double popularityScore(int itemId) {
        return find(itemId).map(AnimeCatalog::popularityOf).orElse(0.0);
    }

    public static double popularityOf(AnimeRecord record) {
        return record.meanScore() * Math.log(record.popularityCount() + 1.0);
    }

    /**
     * Score descending, then higher raw popularity, then lower item id.
     */
    public Comparator<ItemScore> rankingOrder() {
        return Comparator.comparingDouble(ItemScore::score).reversed()
                .thenComparing(Comparator.comparingInt((ItemScore s) -> popularityCount(s.itemId())).reversed())
                .thenComparingInt(ItemScore::itemId);
    }

    public List<ItemScore> rank(Map<Integer, Double> scores) {
        return scores.entrySet().stream()
                .map(e -> new ItemScore(e.getKey(), e.getValue()))
                .sorted(rankingOrder())
                .toList();
    }
}
