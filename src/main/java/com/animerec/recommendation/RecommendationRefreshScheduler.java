package com.animerec.recommendation;

import com.animerec.error.RecommendationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "recommender.refresh", name = "enabled", havingValue = "true")
public class RecommendationRefreshScheduler {
    private static final Logger log = LoggerFactory.getLogger(RecommendationRefreshScheduler.class);

    private final RecommendationService recommendationService;

    public RecommendationRefreshScheduler(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @Scheduled(fixedDelayString = "${recommender.refresh.fixed-delay-ms:3600000}",
            initialDelayString = "${recommender.refresh.fixed-delay-ms:3600000}")
    public void scheduledRebuild() {
        try {
            var status = recommendationService.rebuild();
            log.info("Scheduled rebuild published cache version {} ({} users, {} anime)", status.version(), status.users(), status.items());
        } catch (RecommendationException | DataAccessException e) {
            log.error("Scheduled rebuild failed, keeping the previous cache version: {}", e.getMessage(), e);
        }
    }
}
