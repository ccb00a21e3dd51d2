package com.animerec;

import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.domain.DomainModels.DataIssue;
import com.animerec.domain.DomainModels.Rating;
import com.animerec.store.RatingStore;
import com.animerec.validation.DatasetValidator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatasetValidatorTest {
    private final DatasetValidator validator = new DatasetValidator();

    @Test
    void acceptsConsistentDataset() {
        assertTrue(validator.validate(Fixtures.catalog(), RatingStore.of(Fixtures.ratings())).isEmpty());
    }

    @Test
    void reportsEveryKindOfIssue() {
        List<AnimeRecord> records = new ArrayList<>(Fixtures.catalog());
        records.add(Fixtures.anime(1, "Steel Fist (again)", "Action", "", 8.0, 10));
        records.add(Fixtures.anime(11, "Broken", "Drama", "", 11.5, -3));
        RatingStore ratings = RatingStore.of(List.of(new Rating(1, 1, 8), new Rating(1, 404, 6)));

        List<String> codes = validator.validate(records, ratings).stream().map(DataIssue::code).toList();
        assertTrue(codes.contains("DUPLICATE_ANIME"));
        assertTrue(codes.contains("NEGATIVE_POPULARITY"));
        assertTrue(codes.contains("MEAN_SCORE_OUT_OF_RANGE"));
        assertTrue(codes.contains("UNKNOWN_ANIME_REFERENCE"));
        assertEquals(4, codes.size());
    }

    @Test
    void unknownReferenceCarriesTheMissingId() {
        RatingStore ratings = RatingStore.of(List.of(new Rating(5, 77, 6)));
        List<DataIssue> issues = validator.validate(Fixtures.catalog(), ratings);
        assertEquals(1, issues.size());
        assertEquals("77", issues.get(0).ref());
    }
}
