package com.demo.coffeeshop.product;

import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ProductViewRepository {

    private static final RowMapper<ProductView> ROW_MAPPER = (rs, i) -> new ProductView(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("description"),
            MoneyAmounts.of(rs.getBigDecimal("price"), rs.getString("currency")),
            rs.getString("sku"),
            rs.getBoolean("active"),
            rs.getTimestamp("updated_at").toInstant());

    private final JdbcTemplate jdbc;

    public Optional<ProductView> findById(String id) {
        return jdbc.query("SELECT * FROM product_view WHERE id = ?", ROW_MAPPER, id).stream().findFirst();
    }

    public List<ProductView> findAll(boolean includeInactive) {
        if (includeInactive) {
            return jdbc.query("SELECT * FROM product_view ORDER BY name", ROW_MAPPER);
        }
        return jdbc.query("SELECT * FROM product_view WHERE active = TRUE ORDER BY name", ROW_MAPPER);
    }

    public void save(ProductView v) {
        int updated = jdbc.update("""
                UPDATE product_view
                SET name = ?, description = ?, price = ?, currency = ?, sku = ?, active = ?, updated_at = ?
                WHERE id = ?
                """,
                v.name(), v.description(), MoneyAmounts.amount(v.price()), MoneyAmounts.currency(v.price()), v.sku(), v.active(),
                Timestamp.from(v.updatedAt()), v.id());
        if (updated == 0) {
            jdbc.update("""
                    INSERT INTO product_view (id, name, description, price, currency, sku, active, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    v.id(), v.name(), v.description(), MoneyAmounts.amount(v.price()), MoneyAmounts.currency(v.price()), v.sku(),
                    v.active(), Timestamp.from(v.updatedAt()));
        }
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM product_view");
    }
}
