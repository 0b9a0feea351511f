package com.demo.coffeeshop.payment;

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
public class PaymentViewRepository {

    private static final RowMapper<PaymentView> ROW_MAPPER = (rs, i) -> new PaymentView(
            rs.getString("id"),
            rs.getString("order_id"),
            MoneyAmounts.of(rs.getBigDecimal("amount"), rs.getString("currency")),
            rs.getString("status"),
            rs.getString("transaction_id"),
            rs.getString("refund_id"),
            rs.getString("failure_reason"),
            rs.getTimestamp("updated_at").toInstant());

    private final JdbcTemplate jdbc;

    public Optional<PaymentView> findById(String id) {
        return jdbc.query("SELECT * FROM payment_view WHERE id = ?", ROW_MAPPER, id).stream().findFirst();
    }

    public List<PaymentView> findByOrderId(String orderId) {
        return jdbc.query("SELECT * FROM payment_view WHERE order_id = ? ORDER BY updated_at", ROW_MAPPER, orderId);
    }

    public List<PaymentView> findByStatus(String status) {
        return jdbc.query("SELECT * FROM payment_view WHERE status = ? ORDER BY updated_at", ROW_MAPPER, status);
    }

    public List<PaymentView> findAll(int limit) {
        return jdbc.query("SELECT * FROM payment_view ORDER BY updated_at LIMIT ?", ROW_MAPPER, limit);
    }

    public void save(PaymentView v) {
        int updated = jdbc.update("""
                UPDATE payment_view
                SET order_id = ?, amount = ?, currency = ?, status = ?, transaction_id = ?, refund_id = ?,
                    failure_reason = ?, updated_at = ?
                WHERE id = ?
                """,
                v.orderId(), MoneyAmounts.amount(v.amount()), MoneyAmounts.currency(v.amount()), v.status(), v.transactionId(),
                v.refundId(), v.failureReason(), Timestamp.from(v.updatedAt()), v.id());
        if (updated == 0) {
            jdbc.update("""
                    INSERT INTO payment_view
                      (id, order_id, amount, currency, status, transaction_id, refund_id, failure_reason, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """,
                    v.id(), v.orderId(), MoneyAmounts.amount(v.amount()), MoneyAmounts.currency(v.amount()), v.status(),
                    v.transactionId(), v.refundId(), v.failureReason(), Timestamp.from(v.updatedAt()));
        }
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM payment_view");
    }
}
