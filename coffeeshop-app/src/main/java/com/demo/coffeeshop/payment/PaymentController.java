package com.demo.coffeeshop.payment;

import com.demo.coffeeshop.web.CommandResponse;
import com.myorg.cafe.contracts.coffeeshop.payment.PaymentCommand.*;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.exception.AggregateNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.List;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.PAYMENT_AGGREGATE;

@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService payments;
    private final PaymentViewRepository views;

    public record CreatePaymentRequest(String id, String orderId, BigDecimal amount, String currency) {}
    public record FailPaymentRequest(String reason) {}

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CommandResponse create(@RequestBody CreatePaymentRequest req) {
        if (req.amount() == null) throw new IllegalArgumentException("amount is required");
        return CommandResponse.of(payments.execute(
                new CreatePayment(req.id(), req.orderId(), MoneyAmounts.of(req.amount(), req.currency()))));
    }

    @PostMapping("/{id}/process")
    public CommandResponse process(@PathVariable String id) {
        return CommandResponse.of(payments.execute(new ProcessPayment(id)));
    }

    @PostMapping("/{id}/fail")
    public CommandResponse fail(@PathVariable String id, @RequestBody(required = false) FailPaymentRequest req) {
        return CommandResponse.of(payments.execute(new FailPayment(id, req == null ? null : req.reason())));
    }

    @PostMapping("/{id}/refund")
    public CommandResponse refund(@PathVariable String id) {
        return CommandResponse.of(payments.execute(new RefundPayment(id)));
    }

    @PostMapping("/{id}/reset")
    public CommandResponse reset(@PathVariable String id) {
        return CommandResponse.of(payments.execute(new ResetPayment(id)));
    }

    @GetMapping("/{id}")
    public PaymentView get(@PathVariable String id) {
        return views.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No payment view for " + id));
    }

    @GetMapping("/{id}/state")
    public PaymentState state(@PathVariable String id) {
        AggregateState<PaymentState> s = payments.load(id);
        if (!s.exists()) throw new AggregateNotFoundException(PAYMENT_AGGREGATE, id);
        return s.state();
    }

    @GetMapping
    public List<PaymentView> list(@RequestParam(required = false) String orderId,
                                  @RequestParam(required = false) String status,
                                  @RequestParam(defaultValue = "100") int limit) {
        if (orderId != null) return views.findByOrderId(orderId);
        if (status != null) return views.findByStatus(status.toUpperCase());
        return views.findAll(limit);
    }
}
