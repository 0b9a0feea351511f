package com.demo.coffeeshop.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.ORDER_SUBMITTED;

/** Converts {@code totalAmount} and the price of every submitted item. */
@Component
public class OrderSubmittedUpcaster extends BaseMoneyUpcaster {

    private final ItemPrices itemPrices = new ItemPrices();

    public OrderSubmittedUpcaster() {
        super(ORDER_SUBMITTED, "totalAmount");
    }

    @Override
    public JsonNode upcast(ObjectNode payload) {
        JsonNode items = payload.get("items");
        if (items != null && items.isArray()) {
            items.forEach(item -> {
                if (item instanceof ObjectNode obj) itemPrices.upcast(obj);
            });
        }
        return super.upcast(payload);
    }

    private static final class ItemPrices extends BaseMoneyUpcaster {
        ItemPrices() {
            super(ORDER_SUBMITTED, "price");
        }
    }
}
