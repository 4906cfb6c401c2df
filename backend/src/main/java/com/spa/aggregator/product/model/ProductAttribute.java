package com.spa.aggregator.product.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.spa.aggregator.product.model.ValueKind.FLAG;
import static com.spa.aggregator.product.model.ValueKind.MAP;
import static com.spa.aggregator.product.model.ValueKind.NUMBER;
import static com.spa.aggregator.product.model.ValueKind.TEXT;

/**
 * Scalar attributes of a {@link NormalizedProduct}. The key is the persisted snake_case name.
 */
public enum ProductAttribute {
    // document
    SOURCE_FILE_NAME(TEXT),
    SOURCE_FILE_HASH_SHA256(TEXT),
    DOCUMENT_LANGUAGE(TEXT),
    DOCUMENT_TIMESTAMP(TEXT),
    DOCUMENT_TYPE(TEXT),
    PARSE_VERSION(TEXT),
    PARSE_CONFIDENCE(NUMBER),

    // issuer and venue
    ISSUER_NAME(TEXT),
    ISSUER_LEI(TEXT),
    ISSUER_RATING(TEXT),
    ISSUER_REGULATOR(TEXT),
    CALCULATION_AGENT(TEXT),
    PAYING_AGENT(TEXT),
    LEAD_MANAGER(TEXT),
    GOVERNING_LAW(TEXT),
    JURISDICTION(TEXT),
    RISK_DISCLOSURE_FLAGS(MAP),

    // identifiers
    PRODUCT_NAME(TEXT),
    PRODUCT_TYPE(TEXT),
    SSPA_CATEGORY(TEXT),
    VALOR_NUMBER(TEXT),
    ISIN(TEXT),
    WKN(TEXT),
    TICKER_SIX(TEXT),
    LISTING_VENUE(TEXT),

    // monetary terms
    CURRENCY(TEXT),
    QUANTO(FLAG),
    FX_RISK_FLAG(FLAG),
    ISSUE_PRICE_PCT(NUMBER),
    DENOMINATION(NUMBER),
    MIN_INVESTMENT(NUMBER),
    TRADE_UNIT(NUMBER),
    TER_PCT(NUMBER),
    IEV_PCT(NUMBER),
    DISTRIBUTION_FEE_PCT(NUMBER),
    MARKET_EXPECTATION(TEXT),
    YIELD_TO_MATURITY_PCT_PA(NUMBER),
    WORST_TO_YIELD_PCT_PA(NUMBER),

    // coupon
    COUPON_RATE_PCT_PA(NUMBER),
    COUPON_FREQUENCY(TEXT),
    COUPON_TYPE(TEXT),
    COUPON_IS_GUARANTEED(FLAG),
    TAX_COUPON_SPLIT(MAP),
    INTEREST_COMPONENT_PCT_PA(NUMBER),
    PREMIUM_COMPONENT_PCT_PA(NUMBER),

    // dates
    SUBSCRIPTION_START(TEXT),
    SUBSCRIPTION_END(TEXT),
    INITIAL_FIXING_DATE(TEXT),
    ISSUE_DATE(TEXT),
    SETTLEMENT_DATE(TEXT),
    FINAL_FIXING_DATE(TEXT),
    MATURITY_DATE(TEXT),
    REDEMPTION_DATE(TEXT),
    LAST_TRADING_DAY(TEXT),

    // barrier
    BARRIER_TYPE(TEXT),
    BARRIER_OBSERVATION_START(TEXT),
    BARRIER_OBSERVATION_END(TEXT),
    BARRIER_TRIGGER_CONDITION(TEXT),
    WORST_OF(FLAG),
    WORST_OF_DEFINITION(TEXT),
    CAP_LEVEL_PCT(NUMBER),
    PARTICIPATION_RATE_PCT(NUMBER),

    // call
    IS_CALLABLE(FLAG),
    CALL_STYLE(TEXT),
    CALL_FIRST_POSSIBLE_AFTER(TEXT),
    CALL_REDEMPTION_AMOUNT_RULE(TEXT),

    // settlement
    SETTLEMENT_TYPE(TEXT),
    SETTLEMENT_CURRENCY(TEXT),
    REDEMPTION_RULES(MAP),
    PHYSICAL_DELIVERY(MAP),
    PAYOFF_SUMMARY_TEXT(TEXT),
    SECONDARY_MARKET_INTENT(TEXT),
    PRICING_CONVENTION(TEXT),
    CUSTODIAN_DEPOSITORY(TEXT),
    CLEARING_SETTLEMENT(TEXT),

    // tax
    SWISS_TAX_CLASSIFICATION(TEXT),
    WITHHOLDING_TAX_INTEREST_COMPONENT(FLAG),
    STAMP_DUTY_SECONDARY_MARKET(FLAG),
    TAX_NOTES_SNIPPET(TEXT),

    // risk
    CAPITAL_PROTECTION(FLAG),
    MAX_LOSS_DESCRIPTION(TEXT),
    ISSUER_CREDIT_RISK(FLAG),
    LIQUIDITY_RISK_FLAG(FLAG),
    RISK_SUMMARY(TEXT);

    private static final Map<String, ProductAttribute> BY_KEY = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(ProductAttribute::key, Function.identity()));

    private final ValueKind kind;
    private final String key;

    ProductAttribute(ValueKind kind) {
        this.kind = kind;
        this.key = name().toLowerCase(Locale.ROOT);
    }

    public ValueKind kind() {
        return kind;
    }

    public String key() {
        return key;
    }

    public static Optional<ProductAttribute> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEY.get(key.trim().toLowerCase(Locale.ROOT)));
    }
}
