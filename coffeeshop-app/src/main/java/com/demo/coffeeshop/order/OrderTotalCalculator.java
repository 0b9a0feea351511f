package com.demo.coffeeshop.order;

import com.myorg.cafe.contracts.coffeeshop.order.OrderItem;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import org.javamoney.moneta.Money;
import org.springframework.stereotype.Component;

import javax.money.CurrencyUnit;
import javax.money.Monetary;
import java.math.BigDecimal;
import java.util.List;

/** Subtotal plus 8.25% tax, rounded half-even to cents, in the currency of the items. */
@Component
public class OrderTotalCalculator {

    static final BigDecimal TAX_RATE = new BigDecimal("0.0825");

    public Money calculateTotal(List<OrderItem> items) {
        Money subTotal = Money.of(BigDecimal.ZERO, currencyOf(items));
        for (OrderItem item : items) {
            subTotal = subTotal.add(item.price().multiply(item.quantity()));
        }
        return subTotal.add(subTotal.multiply(TAX_RATE)).with(MoneyAmounts.HALF_EVEN_CENTS);
    }

    static CurrencyUnit currencyOf(List<OrderItem> items) {
        return items.isEmpty()
                ? Monetary.getCurrency(MoneyAmounts.DEFAULT_CURRENCY)
                : items.get(0).price().getCurrency();
    }
}
