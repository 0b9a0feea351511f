package com.demo.coffeeshop.product;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "cafe.sku")
public class SkuProperties {

    /** Classpath resource with {@code productId,sku} lines. */
    private String mappingResource = "sku-mappings.csv";

    /** Optional file on disk; its entries override the classpath mapping. */
    private String externalFile;
}
