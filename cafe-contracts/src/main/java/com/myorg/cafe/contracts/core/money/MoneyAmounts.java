package com.myorg.cafe.contracts.core.money;

import org.javamoney.moneta.Money;
import org.zalando.jackson.datatype.money.MoneyModule;

import javax.money.MonetaryAmount;
import javax.money.MonetaryOperator;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helpers around JSR-354 amounts as they travel inside event payloads:
 * {@code {"amount": 3.50, "currency": "USD"}}.
 *
 * <p>Payload (de)serialization goes through {@link MoneyModule}; register {@link #jacksonModule()}
 * on every {@code ObjectMapper} that reads or writes coffee-shop events.
 */
public final class MoneyAmounts {

    public static final String DEFAULT_CURRENCY = "USD";

    /** Rounds to cents, half-even. */
    public static final MonetaryOperator HALF_EVEN_CENTS = amount -> amount.getFactory()
            .setNumber(amount.getNumber().numberValue(BigDecimal.class).setScale(2, RoundingMode.HALF_EVEN))
            .create();

    private MoneyAmounts() {
    }

    public static Money usd(String amount) {
        return Money.of(new BigDecimal(amount), DEFAULT_CURRENCY);
    }

    public static Money usd(BigDecimal amount) {
        return Money.of(amount, DEFAULT_CURRENCY);
    }

    /** A blank currency falls back to {@value #DEFAULT_CURRENCY}. */
    public static Money of(BigDecimal amount, String currency) {
        return Money.of(amount, currency == null || currency.isBlank() ? DEFAULT_CURRENCY : currency);
    }

    public static BigDecimal amount(MonetaryAmount money) {
        return money.getNumber().numberValue(BigDecimal.class);
    }

    public static String currency(MonetaryAmount money) {
        return money.getCurrency().getCurrencyCode();
    }

    /** Numeric comparison, scale-insensitive (3.5 matches "3.50"). */
    public static boolean hasAmount(MonetaryAmount money, String amount) {
        return money != null && amount(money).compareTo(new BigDecimal(amount)) == 0;
    }

    public static MoneyModule jacksonModule() {
        return new MoneyModule();
    }
}
