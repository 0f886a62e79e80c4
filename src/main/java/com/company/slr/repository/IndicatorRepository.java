package com.company.slr.repository;

import com.company.slr.domain.Indicator;
import com.company.slr.util.TimeUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to indicator configuration owned by the CRUD layer, plus the tombstone purge.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class IndicatorRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String SELECT_BASE = """
        SELECT i.id, i.product_id, p.name AS product_name, i.name, i.slug, i.unit,
               i.source, i.aggregation, i.is_deleted, i.created, i.updated
        FROM indicator i
        JOIN product p ON p.id = i.product_id
        """;

    public Optional<Indicator> findById(long indicatorId) {
        String sql = SELECT_BASE + " WHERE i.id = ?";

        List<Indicator> results = jdbcTemplate.query(sql, new IndicatorRowMapper(), indicatorId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Indicator> findAllActive() {
        String sql = SELECT_BASE + " WHERE i.is_deleted = false ORDER BY i.id";
        return jdbcTemplate.query(sql, new IndicatorRowMapper());
    }

    public long countActive() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM indicator WHERE is_deleted = false", Long.class);
        return count == null ? 0 : count;
    }

    /**
     * Hard-deletes soft-deleted indicators. Rows still referenced by a target are kept
     * until the target goes away; their values cascade with them.
     */
    @Transactional
    public int deleteAllSoftDeleted() {
        String sql = """
            DELETE FROM indicator
            WHERE is_deleted = true
            AND NOT EXISTS (SELECT 1 FROM target t WHERE t.indicator_id = indicator.id)
            """;
        return jdbcTemplate.update(sql);
    }

    private Map<String, Object> parseSource(String json) {
        if (json == null) return Map.of();

        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse indicator source config", e);
        }
    }

    private class IndicatorRowMapper implements RowMapper<Indicator> {
        @Override
        public Indicator mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Indicator.builder()
                    .id(rs.getLong("id"))
                    .productId(rs.getLong("product_id"))
                    .productName(rs.getString("product_name"))
                    .name(rs.getString("name"))
                    .slug(rs.getString("slug"))
                    .unit(rs.getString("unit"))
                    .source(parseSource(rs.getString("source")))
                    .aggregation(rs.getString("aggregation"))
                    .deleted(rs.getBoolean("is_deleted"))
                    .createdAt(TimeUtils.fromUtcDateTime(rs.getObject("created", LocalDateTime.class)))
                    .updatedAt(TimeUtils.fromUtcDateTime(rs.getObject("updated", LocalDateTime.class)))
                    .build();
        }
    }
}
