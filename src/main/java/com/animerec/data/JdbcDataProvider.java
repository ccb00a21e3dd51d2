package com.animerec.data;

import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.repository.AnimeJdbcRepository;
import com.animerec.repository.RatingJdbcRepository;
import com.animerec.store.RatingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class JdbcDataProvider implements DataProvider {
    private static final Logger log = LoggerFactory.getLogger(JdbcDataProvider.class);

    private final AnimeJdbcRepository animeRepository;
    private final RatingJdbcRepository ratingRepository;

    public JdbcDataProvider(AnimeJdbcRepository animeRepository, RatingJdbcRepository ratingRepository) {
        this.animeRepository = animeRepository;
        this.ratingRepository = ratingRepository;
    }

    @Override
    public RatingStore loadRatings() {
        RatingStore.Builder builder = RatingStore.builder();
        ratingRepository.forEach(builder::add);
        RatingStore store = builder.build();
        log.info("Loaded {} ratings from {} users", store.ratingCount(), store.userCount());
        return store;
    }

    @Override
    public List<AnimeRecord> loadAnimeMetadata() {
        List<AnimeRecord> records = animeRepository.findAll();
        log.info("Loaded {} anime records", records.size());
        return records;
    }
}
