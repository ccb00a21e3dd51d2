package com.animerec.recommendation;

import com.animerec.config.RecommenderProperties;
import com.animerec.config.RecommenderSettings;
import com.animerec.content.ContentEngine;
import com.animerec.data.DataProvider;
import com.animerec.data.Dataset;
import com.animerec.domain.DomainModels.AnimeRecord;
import com.animerec.domain.DomainModels.DataIssue;
import com.animerec.domain.DomainModels.StrategyInfo;
import com.animerec.domain.DomainModels.UserRatings;
import com.animerec.error.InconsistentDataException;
import com.animerec.error.UnknownItemException;
import com.animerec.recommendation.RecommendationModels.CacheStatus;
import com.animerec.recommendation.RecommendationModels.RecommendationResult;
import com.animerec.recommendation.RecommendationModels.SimilarItem;
import com.animerec.store.AnimeCatalog;
import com.animerec.store.RatingStore;
import com.animerec.validation.DatasetValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Entry point for callers. Owns the loaded rating corpus and catalog together with the caches derived
 * from them. A cache version is published only once fully built, so readers see either the previous
 * or the next complete version; {@link #rebuild()} and {@link #invalidate()} are the only writers.
 */
@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final DataProvider dataProvider;
    private final DatasetValidator validator;
    private final RecommenderProperties properties;
    private final ContentEngine contentEngine;
    private final Map<RecommendationMode, RecommendationStrategy> strategies;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong versions = new AtomicLong();
    private volatile Dataset dataset;
    private volatile EngineSnapshot snapshot;

    public RecommendationService(DataProvider dataProvider,
                                 DatasetValidator validator,
                                 RecommenderProperties properties,
                                 ContentEngine contentEngine,
                                 List<RecommendationStrategy> strategies) {
        this.dataProvider = dataProvider;
        this.validator = validator;
        this.properties = properties;
        this.contentEngine = contentEngine;
        Map<RecommendationMode, RecommendationStrategy> byMode = new EnumMap<>(RecommendationMode.class);
        for (RecommendationStrategy strategy : strategies) {
            if (byMode.putIfAbsent(strategy.mode(), strategy) != null) {
                throw new IllegalStateException("Two strategies registered for mode " + strategy.mode().value());
            }
        }
        this.strategies = Collections.unmodifiableMap(byMode);
    }

    public RecommendationResult recommend(int userId, Integer topN, String mode) {
        return recommend(userId, topN, RecommendationMode.fromValue(mode));
    }

    public RecommendationResult recommend(int userId, Integer topN, RecommendationMode mode) {
        Objects.requireNonNull(mode, "mode");
        RecommendationStrategy strategy = strategies.get(mode);
        if (strategy == null) throw new IllegalArgumentException("No strategy registered for mode " + mode.value());

        EngineSnapshot current = snapshot();
        int limit = resolveTopN(current.settings(), topN);
        RecommendationResult result = strategy.recommend(current, userId, limit);
        log.debug("Recommended {} items to user {} (mode={}, alpha={}, coldStart={}, approximate={}, cacheVersion={})",
                result.items().size(), userId, mode.value(), result.alpha(), result.coldStartFallback(),
                result.approximate(), result.cacheVersion());
        return result;
    }

    public List<SimilarItem> similarTo(int itemId, Integer topN) {
        EngineSnapshot current = snapshot();
        int limit = resolveTopN(current.settings(), topN);
        return contentEngine.similarTo(current, itemId, limit).stream()
                .map(s -> new SimilarItem(s.itemId(), current.title(s.itemId()), s.score()))
                .toList();
    }

    public List<SimilarItem> popular(Integer topN) {
        EngineSnapshot current = snapshot();
        int limit = resolveTopN(current.settings(), topN);
        AnimeCatalog catalog = current.catalog();
        Map<Integer, Double> scores = catalog.records().stream()
                .collect(Collectors.toMap(AnimeRecord::itemId, AnimeCatalog::popularityOf));
        return catalog.rank(scores).stream()
                .limit(limit)
                .map(s -> new SimilarItem(s.itemId(), current.title(s.itemId()), s.score()))
                .toList();
    }

    public List<StrategyInfo> strategies() {
        return strategies.values().stream()
                .map(s -> new StrategyInfo(s.mode().value(), s.description()))
                .toList();
    }

    public UserRatings userRatings(int userId) {
        return new UserRatings(userId, snapshot().ratings().ratingsOf(userId));
    }

    public AnimeRecord anime(int itemId) {
        return snapshot().catalog().find(itemId).orElseThrow(() -> new UnknownItemException(itemId));
    }

    /**
     * Reloads data from the provider and publishes a freshly built cache version. On failure the
     * previous version stays in place.
     */
    public CacheStatus rebuild() {
        writeLock.lock();
        try {
            Dataset loaded = loadDataset();
            EngineSnapshot built = build(loaded);
            dataset = loaded;
            snapshot = built;
            log.info("Rebuilt recommendation caches, version {}", built.version());
            return status(built);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drops derived caches; the next call rebuilds them lazily from the already loaded data.
     */
    public void invalidate() {
        writeLock.lock();
        try {
            snapshot = null;
            log.info("Recommendation caches invalidated");
        } finally {
            writeLock.unlock();
        }
    }

    public CacheStatus status() {
        return status(snapshot);
    }

    private CacheStatus status(EngineSnapshot s) {
        if (s == null) return new CacheStatus(versions.get(), false, 0, 0, 0, false, 0);
        return new CacheStatus(s.version(), true, s.ratings().userCount(), s.catalog().size(), s.ratings().ratingCount(),
                s.neighborIndex().approximate(), s.tfIdf().vocabularySize());
    }

    private EngineSnapshot snapshot() {
        EngineSnapshot current = snapshot;
        if (current != null) return current;
        writeLock.lock();
        try {
            if (snapshot == null) {
                Dataset data = dataset != null ? dataset : loadDataset();
                EngineSnapshot built = build(data);
                dataset = data;
                snapshot = built;
            }
            return snapshot;
        } finally {
            writeLock.unlock();
        }
    }

    private EngineSnapshot build(Dataset data) {
        RecommenderSettings settings = properties.toSettings();
        long started = System.currentTimeMillis();
        EngineSnapshot built = EngineSnapshot.build(versions.incrementAndGet(), settings, data.ratings(), data.catalog());
        log.info("Built cache version {} in {} ms ({} users, {} anime, neighbor pool {})",
                built.version(), System.currentTimeMillis() - started, data.ratings().userCount(),
                data.catalog().size(), built.neighborIndex().poolSize());
        return built;
    }

    private Dataset loadDataset() {
        List<AnimeRecord> records = dataProvider.loadAnimeMetadata();
        RatingStore ratings = dataProvider.loadRatings();
        List<DataIssue> issues = validator.validate(records, ratings);
        if (!issues.isEmpty()) {
            log.error("Rejected dataset with {} issues, first: {}", issues.size(), issues.get(0));
            throw new InconsistentDataException(issues);
        }
        return new Dataset(ratings, AnimeCatalog.of(records));
    }

    private int resolveTopN(RecommenderSettings settings, Integer requested) {
        if (requested == null) return settings.defaultTopN();
        if (requested <= 0) throw new IllegalArgumentException("topN must be positive, got " + requested);
        return Math.min(requested, settings.maxTopN());
    }
}
