package com.animerec.api;

import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.domain.DomainModels.StrategyInfo;
import com.animerec.domain.DomainModels.UserRatings;
import com.animerec.recommendation.RecommendationModels;
import com.animerec.recommendation.RecommendationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {
    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<RecommendationModels.RecommendationResult> recommend(@PathVariable int userId,
                                                                               @RequestParam(required = false) Integer topN,
                                                                               @RequestParam(required = false, defaultValue = "hybrid") String mode) {
        return ResponseEntity.ok(recommendationService.recommend(userId, topN, mode));
    }

    @GetMapping("/users/{userId}/ratings")
    public ResponseEntity<UserRatings> ratings(@PathVariable int userId) {
        return ResponseEntity.ok(recommendationService.userRatings(userId));
    }

    @GetMapping("/anime/{itemId}")
    public ResponseEntity<AnimeRecord> anime(@PathVariable int itemId) {
        return ResponseEntity.ok(recommendationService.anime(itemId));
    }

    @GetMapping("/anime/{itemId}/similar")
    public ResponseEntity<List<RecommendationModels.SimilarItem>> similar(@PathVariable int itemId,
                                                                        @RequestParam(required = false) Integer topN) {
        return ResponseEntity.ok(recommendationService.similarTo(itemId, topN));
    }

    @GetMapping("/popular")
    public ResponseEntity<List<RecommendationModels.SimilarItem>> popular(@RequestParam(required = false) Integer topN) {
        return ResponseEntity.ok(recommendationService.popular(topN));
    }

    @GetMapping("/strategies")
    public ResponseEntity<List<StrategyInfo>> strategies() {
        return ResponseEntity.ok(recommendationService.strategies());
    }

    @GetMapping("/cache")
    public ResponseEntity<RecommendationModels.CacheStatus> cacheStatus() {
        return ResponseEntity.ok(recommendationService.status());
    }

    @PostMapping("/cache/rebuild")
    public ResponseEntity<RecommendationModels.CacheStatus> rebuild() {
        return ResponseEntity.ok(recommendationService.rebuild());
    }

    @PostMapping("/cache/invalidate")
    public ResponseEntity<Void> invalidate() {
        recommendationService.invalidate();
        return ResponseEntity.accepted().build();
    }
}
