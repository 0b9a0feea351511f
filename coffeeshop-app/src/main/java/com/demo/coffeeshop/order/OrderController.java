package com.demo.coffeeshop.order;

import com.demo.coffeeshop.web.CommandResponse;
import com.myorg.cafe.contracts.coffeeshop.order.OrderCommand.*;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.exception.AggregateNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.List;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.ORDER_AGGREGATE;

@RestController
@RequestMapping("/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orders;
    private final OrderViewRepository views;

    public record CreateOrderRequest(String id, String customerId) {}
    public record AddItemRequest(String productId, String productName, int quantity, BigDecimal price,
                                 String currency) {}
    public record CorrectNameRequest(String correctedProductName) {}

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CommandResponse create(@RequestBody CreateOrderRequest req) {
        return CommandResponse.of(orders.execute(new CreateOrder(req.id(), req.customerId())));
    }

    @PostMapping("/{id}/items")
    public CommandResponse addItem(@PathVariable String id, @RequestBody AddItemRequest req) {
        if (req.price() == null) throw new IllegalArgumentException("price is required");
        return CommandResponse.of(orders.execute(
                new AddItemToOrder(id, req.productId(), req.productName(), req.quantity(), MoneyAmounts.of(req.price(), req.currency()))));
    }

    @PostMapping("/{id}/submit")
    public CommandResponse submit(@PathVariable String id) {
        return CommandResponse.of(orders.execute(new SubmitOrder(id)));
    }

    @PostMapping("/{id}/deliver")
    public CommandResponse deliver(@PathVariable String id) {
        return CommandResponse.of(orders.execute(new DeliverOrder(id)));
    }

    @PostMapping("/{id}/complete")
    public CommandResponse complete(@PathVariable String id) {
        return CommandResponse.of(orders.execute(new CompleteOrder(id)));
    }

    @PostMapping("/{id}/items/{productId}/name")
    public CommandResponse correctName(@PathVariable String id, @PathVariable String productId,
                                       @RequestBody CorrectNameRequest req) {
        return CommandResponse.of(orders.execute(
                new CorrectOrderItemProductName(id, productId, req.correctedProductName())));
    }

    @GetMapping("/{id}")
    public OrderView get(@PathVariable String id) {
        return views.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No order view for " + id));
    }

    /** Write-side state, always current even while the view lags behind. */
    @GetMapping("/{id}/state")
    public OrderState state(@PathVariable String id) {
        AggregateState<OrderState> s = orders.load(id);
        if (!s.exists()) throw new AggregateNotFoundException(ORDER_AGGREGATE, id);
        return s.state();
    }

    @GetMapping
    public List<OrderView> list(@RequestParam(required = false) String customerId,
                                @RequestParam(required = false) String status,
                                @RequestParam(defaultValue = "100") int limit) {
        if (customerId != null) return views.findByCustomerId(customerId);
        if (status != null) return views.findByStatus(status.toUpperCase());
        return views.findAll(limit);
    }
}
