package com.demo.coffeeshop.product;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves SKUs for products created before the SKU became mandatory.
 *
 * <p>Lookup order: explicit mapping by product id, then a code derived from the product
 * name, then one derived from the id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkuLookupService {

    static final String LEGACY_SUFFIX = "-LEGACY";
    static final String UNKNOWN_SKU = "UNK" + LEGACY_SUFFIX;
    static final String ID_PREFIX = "PROD-";

    private final SkuProperties props;
    private final Map<String, String> mappings = new ConcurrentHashMap<>();

    @PostConstruct
    void loadMappings() {
        ClassPathResource resource = new ClassPathResource(props.getMappingResource());
        if (resource.exists()) {
            try (InputStream in = resource.getInputStream()) {
                int n = read(in, props.getMappingResource());
                log.info("Loaded {} SKU mappings from classpath:{}", n, props.getMappingResource());
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read SKU mappings from classpath:" + props.getMappingResource(), e);
            }
        } else {
            log.warn("SKU mapping resource classpath:{} not found", props.getMappingResource());
        }

        String external = props.getExternalFile();
        if (external != null && !external.isBlank()) {
            Path path = Path.of(external);
            if (!Files.isReadable(path)) {
                log.warn("External SKU mapping file {} is not readable, skipping", path);
                return;
            }
            try (InputStream in = Files.newInputStream(path)) {
                int n = read(in, path.toString());
                log.info("Loaded {} SKU mappings from {}", n, path);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read SKU mappings from " + path, e);
            }
        }
    }

    public String getSkuForProduct(String productId, String productName) {
        if (productId != null) {
            String mapped = mappings.get(productId);
            if (mapped != null) return mapped;
        }
        if (productName != null && !productName.isBlank()) {
            return fromName(productName);
        }
        log.warn("No mapping and no name for product {}, using id-derived SKU", productId);
        return ID_PREFIX + productId;
    }

    public Map<String, String> mappings() {
        return Map.copyOf(mappings);
    }

    static String fromName(String productName) {
        String head = productName.substring(0, Math.min(3, productName.length()))
                .toUpperCase(Locale.ROOT)
                .replaceAll("[^A-Z0-9]", "");
        return head.isEmpty() ? UNKNOWN_SKU : head + LEGACY_SUFFIX;
    }

    private int read(InputStream in, String source) throws IOException {
        int loaded = 0;
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        int lineNo = 0;
        boolean firstRecord = true;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            if (firstRecord) {
                firstRecord = false;
                if (isHeader(trimmed)) continue;
            }

            String[] parts = trimmed.split(",");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                log.warn("Skipping malformed SKU mapping {}:{} '{}'", source, lineNo, line);
                continue;
            }
            mappings.put(parts[0].trim(), parts[1].trim());
            loaded++;
        }
        return loaded;
    }

    /** First column reads "productId" once case, spaces and underscores are dropped. */
    static boolean isHeader(String line) {
        String firstColumn = line.split(",", 2)[0].toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        return firstColumn.equals("productid");
    }
}
