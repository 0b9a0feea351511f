package com.demo.coffeeshop.product;

import com.myorg.cafe.contracts.coffeeshop.product.ProductCommand;
import com.myorg.cafe.contracts.coffeeshop.product.ProductCommand.*;
import com.myorg.cafe.contracts.coffeeshop.product.ProductEvent;
import com.myorg.cafe.contracts.coffeeshop.product.ProductEvent.*;
import com.myorg.cafe.eventstore.aggregate.AggregateDefinition;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.aggregate.EventTypeTable;
import com.myorg.cafe.eventstore.exception.InvalidStateTransitionException;
import lombok.RequiredArgsConstructor;
import org.javamoney.moneta.Money;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.*;

@Component
@RequiredArgsConstructor
public class ProductDefinition implements AggregateDefinition<ProductState, ProductCommand, ProductEvent> {

    public static final EventTypeTable<ProductEvent> EVENT_TYPES = EventTypeTable.<ProductEvent>builder()
            .register(PRODUCT_CREATED, ProductCreated.class, PRODUCT_CREATED_REVISION)
            .register(PRODUCT_UPDATED, ProductUpdated.class)
            .register(PRODUCT_DELETED, ProductDeleted.class)
            .build();

    private final SkuLookupService skuLookup;

    @Override
    public String aggregateType() {
        return PRODUCT_AGGREGATE;
    }

    @Override
    public ProductState initialState() {
        return ProductState.initial();
    }

    @Override
    public Class<ProductState> stateClass() {
        return ProductState.class;
    }

    @Override
    public EventTypeTable<ProductEvent> eventTypes() {
        return EVENT_TYPES;
    }

    @Override
    public ProductState reduce(ProductState state, ProductEvent event) {
        return event.accept(new ProductEvent.Visitor<>() {
            @Override
            public ProductState visit(ProductCreated e) {
                return new ProductState(e.id(), e.name(), e.description(), e.price(), e.sku(), true);
            }

            @Override
            public ProductState visit(ProductUpdated e) {
                return state.updated(e.name(), e.description(), e.price());
            }

            @Override
            public ProductState visit(ProductDeleted e) {
                return state.deactivated();
            }
        });
    }

    @Override
    public List<ProductEvent> handle(AggregateState<ProductState> current, ProductCommand command) {
        ProductState s = current.state();

        if (command instanceof CreateProduct c) {
            validate(command, s, c.name(), c.price());
            String sku = c.sku() == null || c.sku().isBlank() ? skuLookup.getSkuForProduct(c.id(), c.name()) : c.sku();
            return List.of(new ProductCreated(c.id(), c.name(), c.description(), c.price(), sku));
        }
        if (command instanceof UpdateProduct c) {
            requireActive(command, s);
            validate(command, s, c.name(), c.price());
            return List.of(new ProductUpdated(s.id(), c.name(), c.description(), c.price()));
        }
        if (command instanceof DeleteProduct) {
            requireActive(command, s);
            return List.of(new ProductDeleted(s.id()));
        }
        throw new IllegalArgumentException("Unsupported product command " + command.getClass().getName());
    }

    @Override
    public String targetId(ProductCommand command) {
        return command.id();
    }

    @Override
    public boolean isCreation(ProductCommand command) {
        return command instanceof CreateProduct;
    }

    private static void validate(ProductCommand command, ProductState s, String name, Money price) {
        if (name == null || name.isBlank()) throw reject(command, s, "name is required");
        if (price == null || price.isNegative()) throw reject(command, s, "price must not be negative");
    }

    private static void requireActive(ProductCommand command, ProductState s) {
        if (!s.active()) throw reject(command, s, "Product " + s.id() + " is not active");
    }

    private static InvalidStateTransitionException reject(ProductCommand command, ProductState s, String message) {
        return new InvalidStateTransitionException(command.getClass().getSimpleName(),
                s.active() ? "ACTIVE" : "INACTIVE", message);
    }
}
