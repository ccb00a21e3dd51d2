package com.animerec.recommendation;

import com.animerec.collaborative.UserNeighborIndex;
import com.animerec.config.RecommenderSettings;
import com.animerec.content.TfIdfIndex;
import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.error.EmptyCatalogException;
import com.animerec.store.AnimeCatalog;
import com.animerec.store.RatingStore;

import java.time.Instant;
import java.util.List;

/**
 * One fully built cache version: the data it was derived from, the derived similarity structures and
 * the settings every engine reads. Never mutated after construction.
 */
public record EngineSnapshot(long version,
                             RecommenderSettings settings,
                             RatingStore ratings,
                             AnimeCatalog catalog,
                             UserNeighborIndex neighborIndex,
                             TfIdfIndex tfIdf,
                             Instant builtAt) {

    public static EngineSnapshot build(long version, RecommenderSettings settings, RatingStore ratings, AnimeCatalog catalog) {
        if (catalog.isEmpty()) throw new EmptyCatalogException();
        UserNeighborIndex neighborIndex = UserNeighborIndex.build(ratings, settings.userSampleBudget(), settings.samplingSeed());
        TfIdfIndex tfIdf = TfIdfIndex.build(catalog, settings.maxFeatures());
        return new EngineSnapshot(version, settings, ratings, catalog, neighborIndex, tfIdf, Instant.now());
    }

    public List<Integer> candidatesFor(int userId) {
        RatingStore.UserRow row = ratings.row(userId);
        return catalog.itemIds().stream().filter(id -> !row.contains(id)).toList();
    }

    public String title(int itemId) {
        return catalog.find(itemId).map(AnimeRecord::title).orElse("");
    }
}
