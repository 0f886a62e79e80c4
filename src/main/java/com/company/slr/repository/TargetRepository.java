package com.company.slr.repository;

import com.company.slr.domain.Target;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class TargetRepository {

    private final JdbcTemplate jdbcTemplate;

    public List<Target> findByObjectiveId(long objectiveId) {
        String sql = """
            SELECT id, indicator_id, objective_id, target_from, target_to
            FROM target
            WHERE objective_id = ?
            ORDER BY id
            """;
        return jdbcTemplate.query(sql, new TargetRowMapper(), objectiveId);
    }

    private static class TargetRowMapper implements RowMapper<Target> {
        @Override
        public Target mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Target.builder()
                    .id(rs.getLong("id"))
                    .indicatorId(rs.getLong("indicator_id"))
                    .objectiveId(rs.getLong("objective_id"))
                    .targetFrom(toDouble(rs.getBigDecimal("target_from")))
                    .targetTo(toDouble(rs.getBigDecimal("target_to")))
                    .build();
        }

        private static Double toDouble(BigDecimal value) {
            return value == null ? null : value.doubleValue();
        }
    }
}
