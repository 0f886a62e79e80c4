package com.company.slr.repository;

import com.company.slr.domain.IndicatorValue;
import com.company.slr.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Storage contract for indicator samples: one row per (timestamp, indicator_id).
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class IndicatorValueRepository {

    private final JdbcTemplate jdbcTemplate;

    static final String UPSERT_SQL = """
        INSERT INTO indicatorvalue (timestamp, value, indicator_id)
        VALUES (?, ?, ?)
        ON CONFLICT (timestamp, indicator_id)
        DO UPDATE SET value = EXCLUDED.value
        """;

    /**
     * Upserts a batch of minute values for one indicator in a single transaction, so a
     * concurrent reader sees either all of them or none.
     *
     * @return number of rows written
     */
    @Transactional
    public int upsertAll(long indicatorId, SortedMap<Instant, Double> values) {
        if (values.isEmpty()) {
            return 0;
        }

        List<Object[]> batchArgs = new ArrayList<>(values.size());
        values.forEach((timestamp, value) ->
                batchArgs.add(new Object[]{TimeUtils.toUtcDateTime(timestamp), value, indicatorId}));

        jdbcTemplate.batchUpdate(UPSERT_SQL, batchArgs);

        log.debug("Upserted {} values for indicator {}", batchArgs.size(), indicatorId);
        return batchArgs.size();
    }

    /**
     * Newest stored timestamp in {@code [from, to)}.
     */
    public Optional<Instant> findNewestTimestamp(long indicatorId, Instant from, Instant to) {
        String sql = """
            SELECT MAX(timestamp) FROM indicatorvalue
            WHERE indicator_id = ? AND timestamp >= ? AND timestamp < ?
            """;

        LocalDateTime newest = jdbcTemplate.queryForObject(sql, LocalDateTime.class,
                indicatorId, TimeUtils.toUtcDateTime(from), TimeUtils.toUtcDateTime(to));
        return Optional.ofNullable(TimeUtils.fromUtcDateTime(newest));
    }

    /**
     * Values in {@code [start, end)}, ascending.
     */
    public List<IndicatorValue> findValues(long indicatorId, Instant start, Instant end) {
        String sql = """
            SELECT timestamp, value, indicator_id FROM indicatorvalue
            WHERE indicator_id = ? AND timestamp >= ? AND timestamp < ?
            ORDER BY timestamp
            """;

        return jdbcTemplate.query(sql, new IndicatorValueRowMapper(),
                indicatorId, TimeUtils.toUtcDateTime(start), TimeUtils.toUtcDateTime(end));
    }

    public List<IndicatorValue> findValuesPage(long indicatorId, Instant start, Instant end,
                                               int page, int perPage) {
        String sql = """
            SELECT timestamp, value, indicator_id FROM indicatorvalue
            WHERE indicator_id = ? AND timestamp >= ? AND timestamp < ?
            ORDER BY timestamp
            LIMIT ? OFFSET ?
            """;

        long offset = (long) (page - 1) * perPage;
        return jdbcTemplate.query(sql, new IndicatorValueRowMapper(),
                indicatorId, TimeUtils.toUtcDateTime(start), TimeUtils.toUtcDateTime(end),
                perPage, offset);
    }

    public long countValues(long indicatorId, Instant start, Instant end) {
        String sql = """
            SELECT COUNT(*) FROM indicatorvalue
            WHERE indicator_id = ? AND timestamp >= ? AND timestamp < ?
            """;

        Long count = jdbcTemplate.queryForObject(sql, Long.class,
                indicatorId, TimeUtils.toUtcDateTime(start), TimeUtils.toUtcDateTime(end));
        return count == null ? 0 : count;
    }

    /**
     * Retention: removes every value at or before {@code cutoff}.
     */
    @Transactional
    public int deleteAtOrBefore(Instant cutoff) {
        return jdbcTemplate.update(
                "DELETE FROM indicatorvalue WHERE timestamp <= ?",
                TimeUtils.toUtcDateTime(cutoff));
    }

    /**
     * Removes values of all indicators in {@code [start, end]}.
     */
    @Transactional
    public int deleteBetween(Instant start, Instant end) {
        return jdbcTemplate.update(
                "DELETE FROM indicatorvalue WHERE timestamp >= ? AND timestamp <= ?",
                TimeUtils.toUtcDateTime(start), TimeUtils.toUtcDateTime(end));
    }

    private static class IndicatorValueRowMapper implements RowMapper<IndicatorValue> {
        @Override
        public IndicatorValue mapRow(ResultSet rs, int rowNum) throws SQLException {
            return IndicatorValue.builder()
                    .timestamp(TimeUtils.fromUtcDateTime(rs.getObject("timestamp", LocalDateTime.class)))
                    .value(rs.getBigDecimal("value").doubleValue())
                    .indicatorId(rs.getLong("indicator_id"))
                    .build();
        }
    }
}
