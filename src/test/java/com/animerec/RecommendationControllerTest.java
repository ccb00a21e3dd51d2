package com.animerec;

import com.animerec.recommendation.RecommendationService;
import com.animerec.repository.AnimeJdbcRepository;
import com.animerec.repository.RatingJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RecommendationControllerTest {
    @Autowired
    private MockMvc mockMvc;
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
    void returnsHybridRecommendationsWithFactors() throws Exception {
        mockMvc.perform(get("/api/recommendations/users/{userId}", Fixtures.ACTION_FAN).param("topN", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(Fixtures.ACTION_FAN))
                .andExpect(jsonPath("$.mode").value("HYBRID"))
                .andExpect(jsonPath("$.items", hasSize(3)))
                .andExpect(jsonPath("$.items[0].factors").isArray())
                .andExpect(jsonPath("$.coldStartFallback").value(false));
    }

    @Test
    void mapsDomainFailuresToStatusCodes() throws Exception {
        mockMvc.perform(get("/api/recommendations/anime/{itemId}/similar", 404))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_ITEM"));

        mockMvc.perform(get("/api/recommendations/users/{userId}", Fixtures.NEW_USER).param("mode", "content"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("EMPTY_SEED"));

        mockMvc.perform(get("/api/recommendations/users/{userId}", Fixtures.ACTION_FAN).param("mode", "random"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        mockMvc.perform(get("/api/recommendations/users/{userId}", Fixtures.ACTION_FAN).param("topN", "-1"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/recommendations/users/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void servesCatalogLookups() throws Exception {
        mockMvc.perform(get("/api/recommendations/anime/{itemId}", 5))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Star Pilots"));

        mockMvc.perform(get("/api/recommendations/popular").param("topN", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].itemId").value(5));

        mockMvc.perform(get("/api/recommendations/users/{userId}/ratings", 102))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ratings", hasSize(6)));

        mockMvc.perform(get("/api/recommendations/strategies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)));
    }

    @Test
    void cacheEndpointsRebuildAndInvalidate() throws Exception {
        mockMvc.perform(post("/api/recommendations/cache/rebuild"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.built").value(true))
                .andExpect(jsonPath("$.items").value(10));

        mockMvc.perform(post("/api/recommendations/cache/invalidate"))
                .andExpect(status().isAccepted());

        mockMvc.perform(get("/api/recommendations/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.built").value(false));
    }
}
