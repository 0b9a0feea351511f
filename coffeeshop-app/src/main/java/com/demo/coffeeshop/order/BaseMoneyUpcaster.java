package com.demo.coffeeshop.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventstore.upcast.EventUpcaster;

import java.util.List;

/**
 * Revision 1 order events carried prices as bare decimals. Rewrites the named fields into
 * {@code {"amount": ..., "currency": "USD"}}; fields already in that shape are left alone.
 */
public abstract class BaseMoneyUpcaster implements EventUpcaster {

    private final String eventType;
    private final List<String> moneyFields;

    protected BaseMoneyUpcaster(String eventType, String... moneyFields) {
        this.eventType = eventType;
        this.moneyFields = List.of(moneyFields);
    }

    @Override
    public String eventType() {
        return eventType;
    }

    @Override
    public int sourceRevision() {
        return 1;
    }

    @Override
    public JsonNode upcast(ObjectNode payload) {
        for (String field : moneyFields) {
            JsonNode value = payload.get(field);
            if (value == null || !value.isNumber()) continue;

            ObjectNode money = payload.objectNode();
            money.put("amount", value.decimalValue());
            money.put("currency", MoneyAmounts.DEFAULT_CURRENCY);
            payload.set(field, money);
        }
        return payload;
    }
}
