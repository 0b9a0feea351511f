package com.demo.coffeeshop;

import com.myorg.cafe.contracts.core.money.MoneyAmounts;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.zalando.jackson.datatype.money.MoneyModule;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CoffeeShopApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoffeeShopApplication.class, args);
    }

    /** Picked up by Boot's ObjectMapper, which serializes event payloads, snapshots and HTTP bodies. */
    @Bean
    public MoneyModule moneyModule() {
        return MoneyAmounts.jacksonModule();
    }
}
