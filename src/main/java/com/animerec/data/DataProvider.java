package com.animerec.data;

import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.store.RatingStore;

import java.util.List;

/**
 * Source of the raw rating corpus and anime metadata. Implementations are expected to hand over
 * referentially consistent data; the recommender still validates every load.
 */
public interface DataProvider {
    RatingStore loadRatings();

    List<AnimeRecord> loadAnimeMetadata();
}
