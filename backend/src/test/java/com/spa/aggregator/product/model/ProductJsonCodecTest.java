package com.spa.aggregator.product.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProductJsonCodecTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProductJsonCodec codec = new ProductJsonCodec(objectMapper);

    @Test
    void writesSnakeCaseFieldsWithProvenance() throws Exception {
        NormalizedProduct product = NormalizedProduct.builder()
            .id("p-7")
            .field(ProductAttribute.COUPON_RATE_PCT_PA, 4.5, 0.8, "catalog_api", "4.50% p.a.")
            .build();

        JsonNode root = objectMapper.readTree(codec.toJson(product));

        assertThat(root.path("id").asText()).isEqualTo("p-7");
        JsonNode coupon = root.path("coupon_rate_pct_pa");
        assertThat(coupon.path("value").asDouble()).isEqualTo(4.5);
        assertThat(coupon.path("confidence").asDouble()).isEqualTo(0.8);
        assertThat(coupon.path("source").asText()).isEqualTo("catalog_api");
        assertThat(coupon.path("raw_excerpt").asText()).isEqualTo("4.50% p.a.");
        assertThat(root.has("isin")).isFalse();
        assertThat(root.path("underlyings").isArray()).isTrue();
        assertThat(root.path("audit_trail").isArray()).isTrue();
    }

    @Test
    void readsBackStoredDocumentIncludingListsAndAudit() {
        NormalizedProduct product = NormalizedProduct.builder()
            .field(ProductAttribute.ISIN, "CH0000000001", 0.9, "catalog_api")
            .field(ProductAttribute.QUANTO, true, 0.6, "catalog_api")
            .underlyings(List.of(Underlying.empty()
                .with(UnderlyingAttribute.NAME, Field.of("ABB", 0.9, "catalog_api"))
                .with(UnderlyingAttribute.STRIKE_LEVEL, Field.of(48.2, 0.9, "catalog_api"))))
            .couponSchedule(List.of(new CouponScheduleItem(
                Field.of("2025-06-30", 0.8, "catalog_api"),
                Field.of(2.5, 0.8, "catalog_api"),
                null
            )))
            .appendAudit(new AuditEntry("coupon_rate_pct_pa", "catalog_api", "detail_html", "higher_confidence"))
            .build();

        NormalizedProduct decoded = codec.fromJson(codec.toJson(product));

        assertThat(decoded).isEqualTo(product);
        assertThat(decoded.auditTrail()).isEqualTo(product.auditTrail());
        assertThat(decoded.couponSchedule().get(0).currency().isPresent()).isFalse();
    }

    @Test
    void treatsValuesOfTheWrongKindAsAbsent() {
        String json = """
            {
              "coupon_rate_pct_pa": {"value": "five", "confidence": 0.8, "source": "detail_html"},
              "currency": {"value": "CHF", "confidence": 0.7, "source": "detail_html"}
            }
            """;

        NormalizedProduct decoded = codec.fromJson(json);

        assertThat(decoded.has(ProductAttribute.COUPON_RATE_PCT_PA)).isFalse();
        assertThat(decoded.text(ProductAttribute.CURRENCY).value()).isEqualTo("CHF");
    }

    @Test
    void rejectsInvalidJson() {
        assertThatThrownBy(() -> codec.fromJson("{not json"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(codec.fromJson("  ").isEmpty()).isTrue();
    }
}
