package com.company.slr.repository;

import com.company.slr.domain.Objective;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class ObjectiveRepository {

    private final JdbcTemplate jdbcTemplate;

    public List<Objective> findByProductId(long productId) {
        String sql = """
            SELECT id, product_id, title, description
            FROM objective
            WHERE product_id = ?
            ORDER BY id
            """;
        return jdbcTemplate.query(sql, new ObjectiveRowMapper(), productId);
    }

    private static class ObjectiveRowMapper implements RowMapper<Objective> {
        @Override
        public Objective mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Objective.builder()
                    .id(rs.getLong("id"))
                    .productId(rs.getLong("product_id"))
                    .title(rs.getString("title"))
                    .description(rs.getString("description"))
                    .build();
        }
    }
}
