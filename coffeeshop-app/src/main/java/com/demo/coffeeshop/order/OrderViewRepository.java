package com.demo.coffeeshop.order;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.contracts.coffeeshop.order.OrderItem;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OrderViewRepository {

    private static final TypeReference<List<OrderItem>> ITEMS = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    private final RowMapper<OrderView> rowMapper = (rs, i) -> {
        BigDecimal total = rs.getBigDecimal("total_amount");
        return new OrderView(
                rs.getString("id"),
                rs.getString("customer_id"),
                readItems(rs.getString("items_json")),
                rs.getString("status"),
                total == null ? null : MoneyAmounts.of(total, rs.getString("total_currency")),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    };

    public Optional<OrderView> findById(String id) {
        return jdbc.query("SELECT * FROM order_view WHERE id = ?", rowMapper, id).stream().findFirst();
    }

    public List<OrderView> findByCustomerId(String customerId) {
        return jdbc.query("SELECT * FROM order_view WHERE customer_id = ? ORDER BY created_at", rowMapper, customerId);
    }

    public List<OrderView> findByStatus(String status) {
        return jdbc.query("SELECT * FROM order_view WHERE status = ? ORDER BY created_at", rowMapper, status);
    }

    public List<OrderView> findAll(int limit) {
        return jdbc.query("SELECT * FROM order_view ORDER BY created_at LIMIT ?", rowMapper, limit);
    }

    /** Update when present, insert otherwise. */
    public void save(OrderView v) {
        String itemsJson = writeItems(v.items());
        BigDecimal total = v.totalAmount() == null ? null : MoneyAmounts.amount(v.totalAmount());
        String currency = v.totalAmount() == null ? null : MoneyAmounts.currency(v.totalAmount());

        int updated = jdbc.update("""
                UPDATE order_view
                SET customer_id = ?, items_json = ?, status = ?, total_amount = ?, total_currency = ?, updated_at = ?
                WHERE id = ?
                """,
                v.customerId(), itemsJson, v.status(), total, currency, Timestamp.from(v.updatedAt()), v.id());
        if (updated == 0) {
            jdbc.update("""
                    INSERT INTO order_view
                      (id, customer_id, items_json, status, total_amount, total_currency, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    v.id(), v.customerId(), itemsJson, v.status(), total, currency,
                    Timestamp.from(v.createdAt()), Timestamp.from(v.updatedAt()));
        }
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM order_view");
    }

    private String writeItems(List<OrderItem> items) {
        try {
            return mapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize order items", e);
        }
    }

    private List<OrderItem> readItems(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return mapper.readValue(json, ITEMS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot read order items", e);
        }
    }
}
