package com.demo.coffeeshop.product;

import com.myorg.cafe.contracts.coffeeshop.product.ProductEvent;
import com.myorg.cafe.contracts.coffeeshop.product.ProductEvent.*;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventing.HandlerRegistry;
import com.myorg.cafe.eventing.ProjectionRegistration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.javamoney.moneta.Money;
import org.springframework.stereotype.Component;

import java.time.Instant;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.PRODUCT_GROUP;

@Slf4j
@Component
@RequiredArgsConstructor
public class ProductProjection implements ProjectionRegistration {

    // demo trigger for dead-lettering
    static final String POISON_PRICE = "99.99";

    private final ProductViewRepository repository;

    @Override
    public void register(HandlerRegistry registry) {
        for (String type : ProductDefinition.EVENT_TYPES.types()) {
            bind(registry, type, ProductDefinition.EVENT_TYPES.classOf(type));
            registry.registerIdExtractor(type, payload -> payload.path("id").asText(null));
        }
        registry.registerReset(PRODUCT_GROUP, () -> log.info("Reset product projection, removed {} rows", repository.deleteAll()));
    }

    private <E extends ProductEvent> void bind(HandlerRegistry registry, String type, Class<E> eventClass) {
        registry.register(PRODUCT_GROUP, type, eventClass, (env, event) -> event.accept(new Applier(env)));
    }

    private final class Applier implements ProductEvent.Visitor<Void> {
        private final Instant at;

        Applier(EventEnvelope env) {
            this.at = env.getOccurredAtMs() > 0 ? Instant.ofEpochMilli(env.getOccurredAtMs()) : Instant.now();
        }

        @Override
        public Void visit(ProductCreated e) {
            failFor(e.price(), e.id(), "ProductCreated");
            repository.save(new ProductView(e.id(), e.name(), e.description(), e.price(), e.sku(), true, at));
            return null;
        }

        @Override
        public Void visit(ProductUpdated e) {
            failFor(e.price(), e.id(), "ProductUpdated");
            repository.findById(e.id()).ifPresentOrElse(
                    p -> repository.save(p.updated(e.name(), e.description(), e.price(), at)),
                    () -> log.warn("No product_view row for product {} while applying ProductUpdated, skipping", e.id()));
            return null;
        }

        @Override
        public Void visit(ProductDeleted e) {
            repository.findById(e.id()).ifPresentOrElse(
                    p -> repository.save(p.deactivated(at)),
                    () -> log.warn("No product_view row for product {} while applying ProductDeleted, skipping", e.id()));
            return null;
        }
    }

    private static void failFor(Money price, String productId, String eventName) {
        if (MoneyAmounts.hasAmount(price, POISON_PRICE)) {
            throw new IllegalStateException("Simulated error processing " + eventName + " for product " + productId
                    + " with price " + POISON_PRICE);
        }
    }
}
