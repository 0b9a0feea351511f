package com.demo.coffeeshop.order;

import com.demo.coffeeshop.web.CorrelationIdFilter;
import com.myorg.cafe.contracts.coffeeshop.order.OrderCommand;
import com.myorg.cafe.contracts.coffeeshop.order.OrderEvent;
import com.myorg.cafe.eventstore.aggregate.AggregateEngine;
import com.myorg.cafe.eventstore.aggregate.AggregateEngineFactory;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.aggregate.CommandResult;
import org.springframework.stereotype.Service;

@Service
public class OrderService {

    private final AggregateEngine<OrderState, OrderCommand, OrderEvent> engine;

    public OrderService(AggregateEngineFactory factory, OrderDefinition definition) {
        this.engine = factory.create(definition);
    }

    public CommandResult<OrderState> execute(OrderCommand command) {
        return engine.execute(command, CorrelationIdFilter.currentOrNew());
    }

    public AggregateState<OrderState> load(String orderId) {
        return engine.load(orderId);
    }
}
