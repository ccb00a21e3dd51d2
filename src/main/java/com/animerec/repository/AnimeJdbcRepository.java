package com.animerec.repository;

import com.animerec.domain.DomainModels.AnimeRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class AnimeJdbcRepository {
    private static final RowMapper<AnimeRecord> ROW_MAPPER = (rs, n) -> new AnimeRecord(
            rs.getInt("anime_id"),
            rs.getString("title"),
            parseGenres(rs.getString("genres")),
            rs.getString("synopsis"),
            rs.getDouble("mean_score"),
            rs.getInt("popularity_count"));

    private final JdbcTemplate jdbcTemplate;

    public AnimeJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<AnimeRecord> findAll() {
        return jdbcTemplate.query(
                "SELECT anime_id, title, genres, synopsis, mean_score, popularity_count FROM anime ORDER BY anime_id",
                ROW_MAPPER);
    }

    public void saveAll(List<AnimeRecord> records) {
        jdbcTemplate.batchUpdate(
                "INSERT INTO anime(anime_id, title, genres, synopsis, mean_score, popularity_count) VALUES (?,?,?,?,?,?)",
                records,
                500,
                (ps, r) -> {
                    ps.setInt(1, r.itemId());
                    ps.setString(2, r.title());
                    ps.setString(3, String.join(",", r.genres()));
                    ps.setString(4, r.synopsis());
                    ps.setDouble(5, r.meanScore());
                    ps.setInt(6, r.popularityCount());
                });
    }

    public void deleteAll() {
        jdbcTemplate.update("DELETE FROM anime");
    }

    static Set<String> parseGenres(String csv) {
        if (csv == null || csv.isBlank()) return Set.of();
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
