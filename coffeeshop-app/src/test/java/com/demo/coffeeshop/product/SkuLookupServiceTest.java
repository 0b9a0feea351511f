package com.demo.coffeeshop.product;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SkuLookupServiceTest {

    private static SkuLookupService service(String externalFile) {
        SkuProperties props = new SkuProperties();
        props.setExternalFile(externalFile);
        SkuLookupService s = new SkuLookupService(props);
        s.loadMappings();
        return s;
    }

    @Test
    void mappedIdWins() {
        assertThat(service(null).getSkuForProduct("espresso-001", "Whatever")).isEqualTo("COF-ESP-001");
    }

    @Test
    void nameDerivedSkuForUnmappedProducts() {
        SkuLookupService s = service(null);

        assertThat(s.getSkuForProduct("x-1", "Flat white")).isEqualTo("FLA-LEGACY");
        assertThat(s.getSkuForProduct("x-2", "7up")).isEqualTo("7UP-LEGACY");
        assertThat(s.getSkuForProduct("x-3", "c-a")).isEqualTo("CA-LEGACY");
        assertThat(s.getSkuForProduct("x-4", "!!!")).isEqualTo("UNK-LEGACY");
    }

    @Test
    void idDerivedSkuWithoutName() {
        assertThat(service(null).getSkuForProduct("x-9", null)).isEqualTo("PROD-x-9");
        assertThat(service(null).getSkuForProduct("x-9", "  ")).isEqualTo("PROD-x-9");
    }

    @Test
    void externalFileOverridesClasspathAndSkipsBadLines(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("skus.csv");
        Files.writeString(file, """
                productId,sku
                espresso-001,EXT-ESP

                broken-line
                tea-001,TEA-001
                """);

        SkuLookupService s = service(file.toString());

        assertThat(s.getSkuForProduct("espresso-001", "Espresso")).isEqualTo("EXT-ESP");
        assertThat(s.getSkuForProduct("tea-001", "Tea")).isEqualTo("TEA-001");
        assertThat(s.getSkuForProduct("latte-001", "Latte")).isEqualTo("COF-LAT-001");
        assertThat(s.mappings()).doesNotContainKey("broken-line");
    }

    @Test
    void snakeCaseHeaderIsSkippedAndHeaderlessFilesLoadTheirFirstLine(@TempDir Path dir) throws IOException {
        Path snake = dir.resolve("snake.csv");
        Files.writeString(snake, """
                product_id,sku
                chai-001,TEA-CHA-001
                """);
        Path bare = dir.resolve("bare.csv");
        Files.writeString(bare, """
                # exported 2024-03-01
                matcha-001,TEA-MAT-001
                """);

        assertThat(service(snake.toString()).mappings())
                .containsEntry("chai-001", "TEA-CHA-001")
                .doesNotContainKey("product_id");
        assertThat(service(bare.toString()).mappings()).containsEntry("matcha-001", "TEA-MAT-001");
    }

    @Test
    void missingExternalFileIsSkipped(@TempDir Path dir) {
        SkuLookupService s = service(dir.resolve("absent.csv").toString());

        assertThat(s.mappings()).containsEntry("latte-001", "COF-LAT-001");
    }
}
