package com.animerec;

import com.animerec.config.RecommenderSettings;
import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.domain.DomainModels.Rating;
import com.animerec.recommendation.EngineSnapshot;
import com.animerec.store.AnimeCatalog;
import com.animerec.store.RatingStore;

import java.util.*;

final class Fixtures {
    static final int ACTION_FAN = 101;
    static final int COLD_START_USER = 201;
    static final int NEW_USER = 999;
    static final List<Integer> ACTIVE_USERS = List.of(101, 102, 103, 104, 105, 106);

    private Fixtures() {}

    static AnimeRecord anime(int id, String title, String genres, String synopsis, double mean, int popularity) {
        Set<String> tags = new LinkedHashSet<>();
        for (String g : genres.split(",")) {
            if (!g.isBlank()) tags.add(g.trim());
        }
        return new AnimeRecord(id, title, tags, synopsis, mean, popularity);
    }

    static List<AnimeRecord> catalog() {
        return List.of(
                anime(1, "Steel Fist", "Action,Shounen", "A young fighter trains to win the martial arts tournament", 8.1, 1200),
                anime(2, "Blade Storm", "Action,Adventure", "A swordsman travels across the kingdom fighting demons", 7.9, 900),
                anime(3, "Heart Letters", "Romance,Drama", "Two students exchange letters and fall in love", 7.5, 600),
                anime(4, "Cafe Days", "Romance,Slice of Life", "A quiet cafe where friends share daily life", 7.2, 400),
                anime(5, "Star Pilots", "Sci-Fi,Mecha", "Pilots defend the colony with giant robots in space", 8.4, 1500),
                anime(6, "Orbit Zero", "Sci-Fi,Space", "A crew explores deep space aboard a research ship", 7.7, 700),
                anime(7, "Ghost Hour", "Horror,Mystery", "A detective investigates a haunted school at midnight", 7.0, 300),
                anime(8, "Laugh Track", "Comedy,Slice of Life", "Friends run a comedy club and share daily jokes", 6.9, 250),
                anime(9, "Iron Legion", "Action,Mecha", "Soldiers fight a war with giant robots", 7.8, 1100),
                anime(10, "Spring Song", "Romance,Music", "A pianist falls in love during a spring festival", 7.4, 500));
    }

    static List<Rating> ratings() {
        List<Rating> ratings = new ArrayList<>();
        add(ratings, 101, 1, 9, 2, 8, 9, 9, 5, 7, 6, 6);
        add(ratings, 102, 1, 9, 2, 8, 9, 8, 5, 8, 7, 5, 3, 4);
        add(ratings, 103, 3, 9, 4, 8, 10, 9, 8, 7, 6, 5);
        add(ratings, 104, 1, 8, 2, 9, 9, 9, 5, 6, 4, 3, 7, 6);
        add(ratings, 105, 3, 8, 4, 9, 10, 8, 2, 4, 8, 8);
        add(ratings, 106, 5, 9, 6, 9, 9, 7, 1, 6, 2, 5);
        add(ratings, COLD_START_USER, 1, 9, 3, 8);
        return ratings;
    }

    /**
     * Pairs of (itemId, score) for one user.
     */
    static void add(List<Rating> target, int userId, int... itemScorePairs) {
        for (int i = 0; i < itemScorePairs.length; i += 2) {
            target.add(new Rating(userId, itemScorePairs[i], itemScorePairs[i + 1]));
        }
    }

    static EngineSnapshot snapshot() {
        return snapshot(RecommenderSettings.defaults());
    }

    static EngineSnapshot snapshot(RecommenderSettings settings) {
        return snapshot(settings, catalog(), ratings());
    }

    static EngineSnapshot snapshot(RecommenderSettings settings, List<AnimeRecord> records, List<Rating> ratings) {
        return EngineSnapshot.build(1L, settings, RatingStore.of(ratings), AnimeCatalog.of(records));
    }
}
