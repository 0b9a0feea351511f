package com.demo.coffeeshop.product;

import com.demo.coffeeshop.web.CommandResponse;
import com.myorg.cafe.contracts.coffeeshop.product.ProductCommand.*;
import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import com.myorg.cafe.eventstore.aggregate.AggregateState;
import com.myorg.cafe.eventstore.exception.AggregateNotFoundException;
import lombok.RequiredArgsConstructor;
import org.javamoney.moneta.Money;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.util.List;

import static com.myorg.cafe.contracts.coffeeshop.CoffeeShopEventTypes.PRODUCT_AGGREGATE;

@RestController
@RequestMapping("/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService products;
    private final ProductViewRepository views;

    public record ProductRequest(String id, String name, String description, BigDecimal price, String currency,
                                 String sku) {
        Money money() {
            if (price == null) throw new IllegalArgumentException("price is required");
            return MoneyAmounts.of(price, currency);
        }
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CommandResponse create(@RequestBody ProductRequest req) {
        return CommandResponse.of(products.execute(
                new CreateProduct(req.id(), req.name(), req.description(), req.money(), req.sku())));
    }

    @PutMapping("/{id}")
    public CommandResponse update(@PathVariable String id, @RequestBody ProductRequest req) {
        return CommandResponse.of(products.execute(
                new UpdateProduct(id, req.name(), req.description(), req.money())));
    }

    @DeleteMapping("/{id}")
    public CommandResponse delete(@PathVariable String id) {
        return CommandResponse.of(products.execute(new DeleteProduct(id)));
    }

    @GetMapping("/{id}")
    public ProductView get(@PathVariable String id) {
        return views.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No product view for " + id));
    }

    @GetMapping("/{id}/state")
    public ProductState state(@PathVariable String id) {
        AggregateState<ProductState> s = products.load(id);
        if (!s.exists()) throw new AggregateNotFoundException(PRODUCT_AGGREGATE, id);
        return s.state();
    }

    @GetMapping
    public List<ProductView> list(@RequestParam(defaultValue = "false") boolean includeInactive) {
        return views.findAll(includeInactive);
    }
}
