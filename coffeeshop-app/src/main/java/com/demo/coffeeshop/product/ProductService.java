package com.demo.coffeeshop.product;

import com.demo.coffeeshop.web.CorrelationIdFilter;
import com.myorg.cafe.contracts.coffeeshop.product.ProductCommand;
import com.myorg.cafe.contracts.coffeeshop.product.ProductEvent;
import com.myorg.cafe.eventstore.aggregate.AggregateEngine;
import com.myorg.cafe.eventstore.aggregate.AggregateEngineFactory;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.aggregate.CommandResult;
import org.springframework.stereotype.Service;

@Service
public class ProductService {

    private final AggregateEngine<ProductState, ProductCommand, ProductEvent> engine;

    public ProductService(AggregateEngineFactory factory, ProductDefinition definition) {
        this.engine = factory.create(definition);
    }

    public CommandResult<ProductState> execute(ProductCommand command) {
        return engine.execute(command, CorrelationIdFilter.currentOrNew());
    }

    public AggregateState<ProductState> load(String productId) {
        return engine.load(productId);
    }
}
