package com.demo.coffeeshop.order;

import org.springframework.stereotype.Component;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.ORDER_ITEM_ADDED;

@Component
public class ItemAddedToOrderUpcaster extends BaseMoneyUpcaster {
    public ItemAddedToOrderUpcaster() {
        super(ORDER_ITEM_ADDED, "price");
    }
}
