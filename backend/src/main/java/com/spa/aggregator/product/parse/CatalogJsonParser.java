package com.spa.aggregator.product.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.spa.aggregator.product.model.Field;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.model.Underlying;
import com.spa.aggregator.product.model.UnderlyingAttribute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps one product object of the catalog search API onto a {@link NormalizedProduct}.
 */
@Component
public class CatalogJsonParser implements ProductParser<JsonNode> {
    public static final String SOURCE = "catalog_api";

    private static final Logger log = LoggerFactory.getLogger(CatalogJsonParser.class);

    @Override
    public NormalizedProduct parse(JsonNode product, String sourceHint) {
        if (product == null || !product.isObject()) {
            log.warn("Catalog item is not a JSON object; returning empty record");
            return NormalizedProduct.empty();
        }
        String source = sourceHint == null || sourceHint.isBlank() ? SOURCE : sourceHint;
        try {
            return map(product, source);
        } catch (RuntimeException e) {
            log.warn("Failed to map catalog item {}", product.path("identifiers").path("isin").asText("?"), e);
            return NormalizedProduct.empty();
        }
    }

    private NormalizedProduct map(JsonNode product, String source) {
        NormalizedProduct.Builder builder = NormalizedProduct.builder();

        JsonNode identifiers = product.path("identifiers");
        String isin = text(identifiers, "isin");
        if (isin != null) {
            String evidence = TextUtils.truncateExcerpt("identifiers.isin: " + isin);
            builder.field(ProductAttribute.ISIN, isin, 0.9, source, evidence);
        }
        String valor = text(identifiers, "valor");
        if (valor != null) {
            String evidence = TextUtils.truncateExcerpt("identifiers.valor: " + valor);
            builder.field(ProductAttribute.VALOR_NUMBER, valor, 0.9, source, evidence);
        }
        putText(builder, ProductAttribute.TICKER_SIX, text(identifiers, "symbol"), 0.8, source);
        putText(builder, ProductAttribute.WKN, text(identifiers, "wkn"), 0.8, source);

        JsonNode underlying = product.path("underlying");
        putText(builder, ProductAttribute.PRODUCT_NAME, text(underlying, "shortName"), 0.8, source);

        JsonNode productType = product.path("productType");
        putText(builder, ProductAttribute.PRODUCT_TYPE, text(productType, "name"), 0.8, source);
        putText(builder, ProductAttribute.SSPA_CATEGORY, text(productType, "sspaCategory"), 0.8, source);

        JsonNode issuer = product.path("issuer");
        putText(builder, ProductAttribute.ISSUER_NAME, text(issuer, "name"), 0.9, source);
        putText(builder, ProductAttribute.ISSUER_LEI, text(issuer, "lei"), 0.9, source);

        putText(builder, ProductAttribute.CURRENCY, text(product, "currency"), 0.9, source);
        putNumber(builder, ProductAttribute.DENOMINATION, number(product, "denomination"), 0.9, source);

        JsonNode calendar = product.path("calendar");
        putText(builder, ProductAttribute.MATURITY_DATE, text(calendar, "finalFixingDate"), 0.9, source);
        putText(builder, ProductAttribute.FINAL_FIXING_DATE, text(calendar, "finalFixingDate"), 0.8, source);
        putText(builder, ProductAttribute.ISSUE_DATE, text(calendar, "issueDateTime"), 0.8, source);
        putText(builder, ProductAttribute.SETTLEMENT_DATE, text(calendar, "issueDateTime"), 0.8, source);
        putText(builder, ProductAttribute.INITIAL_FIXING_DATE, text(calendar, "initialFixingDate"), 0.8, source);
        putText(builder, ProductAttribute.SUBSCRIPTION_START, text(calendar, "subscriptionStartDate"), 0.8, source);
        putText(builder, ProductAttribute.SUBSCRIPTION_END, text(calendar, "subscriptionEndDate"), 0.8, source);

        List<String> venues = new ArrayList<>();
        for (JsonNode market : product.path("listings").path("markets")) {
            String venue = text(market, "marketVenue");
            if (venue != null) {
                venues.add(venue);
            }
        }
        if (!venues.isEmpty()) {
            putText(builder, ProductAttribute.LISTING_VENUE, String.join(", ", venues), 0.7, source);
        }

        builder.underlyings(mapUnderlyings(underlying, product.path("levels"), source));

        JsonNode coupon = product.path("coupon");
        putNumber(builder, ProductAttribute.COUPON_RATE_PCT_PA, number(coupon, "rate"), 0.8, source);
        putText(builder, ProductAttribute.COUPON_FREQUENCY, text(coupon, "frequency"), 0.8, source);
        putText(builder, ProductAttribute.COUPON_TYPE, text(coupon, "type"), 0.7, source);

        JsonNode settlement = product.path("settlement");
        putText(builder, ProductAttribute.SETTLEMENT_TYPE, text(settlement, "type"), 0.7, source);
        putText(builder, ProductAttribute.SETTLEMENT_CURRENCY, text(settlement, "currency"), 0.8, source);

        Double participation = number(product.path("payoff"), "participationRate");
        if (participation != null) {
            putNumber(builder, ProductAttribute.PARTICIPATION_RATE_PCT, participation * 100, 0.7, source);
        }
        return builder.build();
    }

    private List<Underlying> mapUnderlyings(JsonNode underlying, JsonNode levels, String source) {
        List<Underlying> result = new ArrayList<>();
        for (JsonNode component : underlying.path("underlyingComponents")) {
            Underlying item = Underlying.empty();
            item = withText(item, UnderlyingAttribute.NAME, text(component, "name"), 0.9, source);
            item = withText(item, UnderlyingAttribute.ISIN, text(component, "isin"), 0.9, source);
            item = withText(item, UnderlyingAttribute.RIC_CODE, text(component, "ricCode"), 0.8, source);
            item = withText(item, UnderlyingAttribute.BLOOMBERG_TICKER, text(component, "bloombergTicker"), 0.8, source);
            item = withText(item, UnderlyingAttribute.REFERENCE_CURRENCY, text(component, "currency"), 0.8, source);
            Double weight = number(component, "weight");
            if (weight != null) {
                item = item.with(UnderlyingAttribute.WEIGHT_PCT, Field.of(weight * 100, 0.8, source));
            }
            result.add(item);
        }

        Double strike = number(levels, "strikeLevelAbs");
        Double barrier = number(levels, "barrierLevelAbs");
        Double knockIn = number(levels, "knockInLevelAbs");
        if (result.isEmpty()) {
            String name = text(underlying, "shortName");
            Underlying single = withText(Underlying.empty(), UnderlyingAttribute.NAME, name, 0.8, source);
            if (strike != null) {
                single = single.with(UnderlyingAttribute.STRIKE_LEVEL, Field.of(strike, 0.7, source));
            }
            Double barrierLevel = barrier != null ? barrier : knockIn;
            if (barrierLevel != null) {
                single = single.with(UnderlyingAttribute.BARRIER_LEVEL, Field.of(barrierLevel, 0.7, source));
            }
            if (!single.isEmpty()) {
                result.add(single);
            }
            return result;
        }

        // Basket components without their own levels inherit the product-level ones.
        List<Underlying> withLevels = new ArrayList<>(result.size());
        for (Underlying item : result) {
            if (!item.get(UnderlyingAttribute.STRIKE_LEVEL).isPresent() && strike != null) {
                item = item.with(UnderlyingAttribute.STRIKE_LEVEL, Field.of(strike, 0.6, source));
            }
            if (!item.get(UnderlyingAttribute.BARRIER_LEVEL).isPresent()) {
                Double barrierLevel = barrier != null ? barrier : knockIn;
                if (barrierLevel != null) {
                    item = item.with(UnderlyingAttribute.BARRIER_LEVEL, Field.of(barrierLevel, 0.6, source));
                }
            }
            withLevels.add(item);
        }
        return withLevels;
    }

    private static Underlying withText(
        Underlying item,
        UnderlyingAttribute attribute,
        String value,
        double confidence,
        String source
    ) {
        return value == null ? item : item.with(attribute, Field.of(value, confidence, source));
    }

    private static void putText(
        NormalizedProduct.Builder builder,
        ProductAttribute attribute,
        String value,
        double confidence,
        String source
    ) {
        if (value != null) {
            builder.field(attribute, value, confidence, source);
        }
    }

    private static void putNumber(
        NormalizedProduct.Builder builder,
        ProductAttribute attribute,
        Double value,
        double confidence,
        String source
    ) {
        if (value != null) {
            builder.field(attribute, value, confidence, source);
        }
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text.trim();
    }

    private static Double number(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
