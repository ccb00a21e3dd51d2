package com.animerec;

import com.animerec.error.UnknownUserException;
import com.animerec.recommendation.RecommendationService;
import com.animerec.repository.AnimeJdbcRepository;
import com.animerec.repository.RatingJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "recommender.unknown-user-fallback=false",
        "recommender.min-ratings-for-personalization=3"
})
class UnknownUserFallbackDisabledTest {
    @Autowired
    private AnimeJdbcRepository animeRepository;
    @Autowired
    private RatingJdbcRepository ratingRepository;
    @Autowired
    private RecommendationService recommendationService;

    @BeforeEach
    void seed() {
        ratingRepository.deleteAll();
        animeRepository.deleteAll();
        animeRepository.saveAll(Fixtures.catalog());
        ratingRepository.saveAll(Fixtures.ratings());
        recommendationService.rebuild();
    }

    @Test
    void unknownUserIsRejectedInCollaborativeAndHybridModes() {
        UnknownUserException ex = assertThrows(UnknownUserException.class,
                () -> recommendationService.recommend(Fixtures.NEW_USER, 5, "collaborative"));
        assertEquals("UNKNOWN_USER", ex.code());
        assertThrows(UnknownUserException.class, () -> recommendationService.recommend(Fixtures.NEW_USER, 5, "hybrid"));
    }

    @Test
    void knownUserBelowThresholdStillFallsBack() {
        assertTrue(recommendationService.recommend(Fixtures.COLD_START_USER, 5, "collaborative").coldStartFallback());
        assertFalse(recommendationService.recommend(Fixtures.ACTION_FAN, 5, "collaborative").coldStartFallback());
    }
}
