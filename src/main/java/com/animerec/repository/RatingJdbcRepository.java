package com.animerec.repository;

import com.animerec.domain.DomainModels.Rating;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.function.Consumer;

@Repository
public class RatingJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public RatingJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Streams rows to the consumer instead of materializing the full result list.
     */
    public void forEach(Consumer<Rating> consumer) {
        jdbcTemplate.query("SELECT user_id, anime_id, rating FROM ratings",
                (RowCallbackHandler) rs -> consumer.accept(new Rating(rs.getInt(1), rs.getInt(2), rs.getDouble(3))));
    }

    public List<Rating> findByUser(int userId) {
        return jdbcTemplate.query("SELECT user_id, anime_id, rating FROM ratings WHERE user_id=? ORDER BY anime_id",
                (rs, n) -> new Rating(rs.getInt(1), rs.getInt(2), rs.getDouble(3)),
                userId);
    }

    public void saveAll(List<Rating> ratings) {
        jdbcTemplate.batchUpdate("INSERT INTO ratings(user_id, anime_id, rating) VALUES (?,?,?)",
                ratings,
                1000,
                (ps, r) -> {
                    ps.setInt(1, r.userId());
                    ps.setInt(2, r.itemId());
                    ps.setDouble(3, r.score());
                });
    }

    public void deleteAll() {
        jdbcTemplate.update("DELETE FROM ratings");
    }
}
