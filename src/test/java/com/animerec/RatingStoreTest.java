package com.animerec;

import com.animerec.domain.DomainModels.Rating;
import com.animerec.domain.DomainModels.UserProfile;
import com.animerec.error.InconsistentDataException;
import com.animerec.store.RatingStore;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class RatingStoreTest {

    @Test
    void rowsAreSortedAndAbsentEntriesMeanUnrated() {
        RatingStore store = RatingStore.of(Fixtures.ratings());

        RatingStore.UserRow row = store.row(102);
        assertEquals(6, row.size());
        for (int i = 1; i < row.size(); i++) {
            assertTrue(row.itemAt(i - 1) < row.itemAt(i));
        }
        assertEquals(4.0, row.score(3).getAsDouble());
        assertTrue(row.score(10).isEmpty());
        assertFalse(row.contains(10));

        assertEquals(0, store.ratingCount(Fixtures.NEW_USER));
        assertFalse(store.containsUser(Fixtures.NEW_USER));
        assertEquals(7, store.userCount());
        assertEquals(Fixtures.ratings().size(), store.ratingCount());
    }

    @Test
    void columnListsEveryRaterOfOneItem() {
        RatingStore store = RatingStore.of(Fixtures.ratings());
        SortedMap<Integer, Double> column = store.column(10);
        assertEquals(List.of(103, 105), new ArrayList<>(column.keySet()));
        assertEquals(9.0, column.get(103));
    }

    @Test
    void rejectsOutOfRangeRatings() {
        InconsistentDataException low = assertThrows(InconsistentDataException.class,
                () -> RatingStore.of(List.of(new Rating(1, 1, 0.5))));
        assertEquals("RATING_OUT_OF_RANGE", low.issues().get(0).code());
        assertThrows(InconsistentDataException.class, () -> RatingStore.of(List.of(new Rating(1, 1, 10.5))));
        assertDoesNotThrow(() -> RatingStore.of(List.of(new Rating(1, 1, 1.0), new Rating(1, 2, 10.0))));
    }

    @Test
    void rejectsDuplicateUserItemPairs() {
        InconsistentDataException ex = assertThrows(InconsistentDataException.class,
                () -> RatingStore.of(List.of(new Rating(7, 3, 8), new Rating(7, 3, 6))));
        assertEquals("DUPLICATE_RATING", ex.issues().get(0).code());
        assertEquals("7:3", ex.issues().get(0).ref());
    }

    @Test
    void profileCarriesMeanAndSampleDeviation() {
        RatingStore store = RatingStore.of(List.of(new Rating(1, 1, 2), new Rating(1, 2, 4), new Rating(1, 3, 6)));
        UserProfile profile = store.profile(1);
        assertEquals(3, profile.ratingCount());
        assertEquals(4.0, profile.meanRating(), 1e-12);
        assertEquals(2.0, profile.ratingStdDev(), 1e-12);

        UserProfile empty = store.profile(2);
        assertEquals(0, empty.ratingCount());
        assertEquals(0.0, empty.ratingStdDev());
    }

    @Test
    void samplingIsDeterministicAndGrowsMonotonically() {
        List<Rating> ratings = new ArrayList<>();
        for (int user = 1; user <= 50; user++) {
            ratings.add(new Rating(user, user % 7 + 1, user % 10 + 1));
        }
        RatingStore store = RatingStore.of(ratings);

        int[] small = store.sampleUsers(10, 42L);
        int[] again = store.sampleUsers(10, 42L);
        int[] large = store.sampleUsers(25, 42L);
        assertArrayEquals(small, again);
        assertEquals(10, small.length);
        assertEquals(25, large.length);

        Set<Integer> largeSet = new HashSet<>();
        for (int u : large) largeSet.add(u);
        for (int u : small) assertTrue(largeSet.contains(u), "user " + u + " missing from larger sample");

        assertArrayEquals(store.userIds(), store.sampleUsers(50, 42L));
        assertArrayEquals(store.userIds(), store.sampleUsers(500, 7L));
    }
}
