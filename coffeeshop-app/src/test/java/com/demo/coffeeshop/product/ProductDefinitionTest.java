package com.demo.coffeeshop.product;

import com.myorg.cafe.contracts.coffeeshop.product.ProductCommand;
import com.myorg.cafe.contracts.coffeeshop.product.ProductCommand.*;
import com.myorg.cafe.contracts.coffeeshop.product.ProductEvent;
import com.myorg.cafe.contracts.coffeeshop.product.ProductEvent.ProductCreated;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProductDefinitionTest {

    private final ProductDefinition definition;
    private final List<ProductEvent> history = new ArrayList<>();
    private AggregateState<ProductState> current = AggregateState.empty("espresso-001", ProductState.initial());

    ProductDefinitionTest() {
        SkuLookupService skus = new SkuLookupService(new SkuProperties());
        skus.loadMappings();
        definition = new ProductDefinition(skus);
    }

    private List<ProductEvent> send(ProductCommand command) {
        List<ProductEvent> events = definition.handle(current, command);
        ProductState state = current.state();
        for (ProductEvent e : events) {
            state = definition.reduce(state, e);
        }
        history.addAll(events);
        current = new AggregateState<>(current.aggregateId(), current.sequence() + events.size(), -1, state);
        return events;
    }

    @Test
    void createFillsMissingSkuFromLookup() {
        List<ProductEvent> events = send(new CreateProduct("espresso-001", "Espresso", "Double shot", MoneyAmounts.usd("3.00"), null));

        assertThat(((ProductCreated) events.get(0)).sku()).isEqualTo("COF-ESP-001");
        assertThat(current.state().active()).isTrue();
    }

    @Test
    void createKeepsGivenSku() {
        List<ProductEvent> events = send(new CreateProduct("espresso-001", "Espresso", null, MoneyAmounts.usd("3.00"), "MY-SKU"));

        assertThat(((ProductCreated) events.get(0)).sku()).isEqualTo("MY-SKU");
    }

    @Test
    void deleteDeactivatesAndBlocksFurtherChanges() {
        send(new CreateProduct("espresso-001", "Espresso", null, MoneyAmounts.usd("3.00"), "SKU"));
        send(new UpdateProduct("espresso-001", "Espresso", "Now stronger", MoneyAmounts.usd("3.20")));
        send(new DeleteProduct("espresso-001"));

        assertThat(current.state().active()).isFalse();
        assertThat(MoneyAmounts.hasAmount(current.state().price(), "3.20")).isTrue();
        assertThatThrownBy(() -> send(new UpdateProduct("espresso-001", "Espresso", null, MoneyAmounts.usd("3.50"))))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("INACTIVE");
        assertThatThrownBy(() -> send(new DeleteProduct("espresso-001")))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void nameAndPriceAreRequired() {
        assertThatThrownBy(() -> send(new CreateProduct("x", "", null, MoneyAmounts.usd("1.00"), null)))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> send(new CreateProduct("x", "Tea", null, null, null)))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void replayingHistoryGivesTheSameState() {
        send(new CreateProduct("espresso-001", "Espresso", null, MoneyAmounts.usd("3.00"), null));
        send(new UpdateProduct("espresso-001", "Double Espresso", "Two shots", MoneyAmounts.usd("3.60")));
        send(new DeleteProduct("espresso-001"));

        ProductState replayed = definition.initialState();
        for (ProductEvent e : history) {
            replayed = definition.reduce(replayed, e);
        }

        assertThat(replayed).isEqualTo(current.state());
        assertThat(replayed.sku()).isEqualTo("COF-ESP-001");
        assertThat(replayed.name()).isEqualTo("Double Espresso");
        assertThat(replayed.active()).isFalse();
    }
}
