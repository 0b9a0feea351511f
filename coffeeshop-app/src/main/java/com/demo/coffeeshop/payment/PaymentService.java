package com.demo.coffeeshop.payment;

import com.demo.coffeeshop.web.CorrelationIdFilter;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentCommand;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentEvent;
import com.myorg.cafe.eventstore.aggregate.AggregateEngine;
import com.myorg.cafe.eventstore.aggregate.AggregateEngineFactory;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.aggregate.CommandResult;
import org.springframework.stereotype.Service;

@Service
public class PaymentService {

    private final AggregateEngine<PaymentState, PaymentCommand, PaymentEvent> engine;

    public PaymentService(AggregateEngineFactory factory, PaymentDefinition definition) {
        this.engine = factory.create(definition);
    }

    public CommandResult<PaymentState> execute(PaymentCommand command) {
        return engine.execute(command, CorrelationIdFilter.currentOrNew());
    }

    public AggregateState<PaymentState> load(String paymentId) {
        return engine.load(paymentId);
    }
}
