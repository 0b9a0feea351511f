package com.demo.coffeeshop.product;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.cafe.eventstore.upcast.EventUpcaster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.PRODUCT_CREATED;

/**
 * Revision 1 of {@code ProductCreated} had no SKU. Backfills one from {@link SkuLookupService};
 * an SKU already present is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductCreatedUpcaster implements EventUpcaster {

    private final SkuLookupService skuLookup;

    @Override
    public String eventType() {
        return PRODUCT_CREATED;
    }

    @Override
    public int sourceRevision() {
        return 1;
    }

    @Override
    public JsonNode upcast(ObjectNode payload) {
        JsonNode sku = payload.get("sku");
        if (sku != null && !sku.isNull() && !sku.asText().isBlank()) {
            return payload;
        }
        String id = payload.path("id").asText(null);
        String name = payload.path("name").asText(null);
        String resolved = skuLookup.getSkuForProduct(id, name);
        log.debug("Backfilled sku={} for legacy ProductCreated id={}", resolved, id);
        payload.put("sku", resolved);
        return payload;
    }
}
