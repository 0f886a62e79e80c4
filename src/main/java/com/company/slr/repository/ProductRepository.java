package com.company.slr.repository;

import com.company.slr.domain.Product;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ProductRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<Product> findById(long productId) {
        String sql = """
            SELECT p.id, p.name, p.slug, g.name AS group_name, g.slug AS group_slug
            FROM product p
            JOIN product_group g ON g.id = p.product_group_id
            WHERE p.id = ?
            """;

        List<Product> results = jdbcTemplate.query(sql, new ProductRowMapper(), productId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static class ProductRowMapper implements RowMapper<Product> {
        @Override
        public Product mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Product.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .slug(rs.getString("slug"))
                    .productGroupName(rs.getString("group_name"))
                    .productGroupSlug(rs.getString("group_slug"))
                    .build();
        }
    }
}
