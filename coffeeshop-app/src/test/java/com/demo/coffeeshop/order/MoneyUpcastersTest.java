package com.demo.coffeeshop.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.cafe.contracts.coffeeshop.order.ItemAddedToOrder;
import com.myorg.cafe.contracts.coffeeshop.order.OrderSubmitted;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventstore.upcast.UpcasterChain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.ORDER_ITEM_ADDED;
import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.ORDER_SUBMITTED;
import static org.assertj.core.api.Assertions.assertThat;

class MoneyUpcastersTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules()
            .registerModule(MoneyAmounts.jacksonModule());
    private final UpcasterChain chain = new UpcasterChain(List.of(new ItemAddedToOrderUpcaster(), new OrderSubmittedUpcaster()));

    private EventEnvelope stored(String type, int revision, String json) throws Exception {
        return EventEnvelope.builder()
                .eventId("e-1")
                .eventType(type)
                .revision(revision)
                .payload(mapper.readTree(json))
                .build();
    }

    @Test
    void legacyItemPriceBecomesMoney() throws Exception {
        EventEnvelope legacy = stored(ORDER_ITEM_ADDED, 1,
                "{\"orderId\":\"o-1\",\"productId\":\"latte-001\",\"productName\":\"Latte\",\"quantity\":2,\"price\":3.5}");

        EventEnvelope up = chain.upcast(legacy);

        assertThat(up.getRevision()).isEqualTo(2);
        assertThat(up.getPayload().path("price").path("currency").asText()).isEqualTo("USD");
        ItemAddedToOrder event = mapper.treeToValue(up.getPayload(), ItemAddedToOrder.class);
        assertThat(MoneyAmounts.hasAmount(event.price(), "3.50")).isTrue();
        // stored payload untouched
        assertThat(legacy.getPayload().path("price").isNumber()).isTrue();
    }

    @Test
    void untaggedRevisionCountsAsOne() throws Exception {
        EventEnvelope legacy = stored(ORDER_ITEM_ADDED, 0,
                "{\"orderId\":\"o-1\",\"productId\":\"p\",\"productName\":\"P\",\"quantity\":1,\"price\":2}");

        assertThat(chain.upcast(legacy).getPayload().path("price").path("amount").decimalValue())
                .isEqualByComparingTo("2");
    }

    @Test
    void legacySubmittedTotalAndItemPricesBecomeMoney() throws Exception {
        EventEnvelope legacy = stored(ORDER_SUBMITTED, 1, """
                {"orderId":"o-1",
                 "items":[{"productId":"latte-001","productName":"Latte","quantity":2,"price":2.5}],
                 "totalAmount":5.41}
                """);

        EventEnvelope up = chain.upcast(legacy);

        OrderSubmitted event = mapper.treeToValue(up.getPayload(), OrderSubmitted.class);
        assertThat(MoneyAmounts.hasAmount(event.totalAmount(), "5.41")).isTrue();
        assertThat(event.items().get(0).price().getCurrency().getCurrencyCode()).isEqualTo("USD");
    }

    @Test
    void currentPayloadsPassThrough() throws Exception {
        EventEnvelope current = stored(ORDER_ITEM_ADDED, 2,
                "{\"orderId\":\"o-1\",\"productId\":\"p\",\"productName\":\"P\",\"quantity\":1,"
                        + "\"price\":{\"amount\":2.00,\"currency\":\"EUR\"}}");

        assertThat(chain.upcast(current)).isSameAs(current);
    }

    @Test
    void upcastingTwiceChangesNothing() throws Exception {
        EventEnvelope legacy = stored(ORDER_ITEM_ADDED, 1,
                "{\"orderId\":\"o-1\",\"productId\":\"p\",\"productName\":\"P\",\"quantity\":1,\"price\":2}");

        EventEnvelope once = chain.upcast(legacy);
        JsonNode twice = chain.upcast(once).getPayload();

        assertThat(twice).isEqualTo(once.getPayload());
    }
}
