package com.spa.aggregator.product.parse;

import com.spa.aggregator.product.model.Field;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.model.Underlying;
import com.spa.aggregator.product.model.UnderlyingAttribute;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts product terms from a public quote page laid out as label/value table rows.
 * The {@code sourceHint} is the ISIN the page was requested for.
 */
@Component
public class DetailPageParser implements ProductParser<String> {
    public static final String SOURCE = "detail_html";

    private static final Logger log = LoggerFactory.getLogger(DetailPageParser.class);
    private static final Pattern PERCENT = Pattern.compile("([0-9]+(?:[.,][0-9]+)?)\\s*%");

    private static final List<String> ISSUER_LABELS = List.of("Emittent", "Issuer");
    private static final List<String> CURRENCY_LABELS = List.of("Währung", "Currency");
    private static final List<String> TYPE_LABELS = List.of("Produkttyp", "Typ", "Type", "Kategorie");
    private static final List<String> COUPON_LABELS = List.of(
        "Kupon", "Coupon", "Zinssatz", "Coupon p.a.", "Verzinsung", "Nominalzins", "Zinsen"
    );
    private static final List<String> BARRIER_LABELS = List.of(
        "Barriere", "Barrier", "Knock-In", "Knock-In Barriere", "Barriere-Level"
    );
    private static final List<String> STRIKE_LABELS = List.of("Strike", "Basispreis", "Ausübungspreis", "Strike Level");
    private static final List<String> CAP_LABELS = List.of("Cap", "Höchstbetrag", "Maximum", "Cap Level");
    private static final List<String> PARTICIPATION_LABELS = List.of(
        "Partizipation", "Partizipationsrate", "Participation", "Participation Rate"
    );
    private static final List<String> MATURITY_LABELS = List.of("Verfall", "Fälligkeit", "Laufzeitende", "Maturity");
    private static final List<String> ISSUE_DATE_LABELS = List.of("Ausgabedatum", "Emissionsdatum", "Issue Date", "Emission");

    @Override
    public NormalizedProduct parse(String html, String sourceHint) {
        if (html == null || html.isBlank()) {
            return NormalizedProduct.empty();
        }
        try {
            return map(Jsoup.parse(html), sourceHint);
        } catch (RuntimeException e) {
            log.warn("Failed to parse detail page for {}", sourceHint, e);
            return NormalizedProduct.empty();
        }
    }

    private NormalizedProduct map(Document document, String requestedIsin) {
        NormalizedProduct.Builder builder = NormalizedProduct.builder();
        String pageIsin = TextUtils.findIsin(document.text());
        if (pageIsin != null) {
            builder.field(ProductAttribute.ISIN, pageIsin, 0.7, SOURCE, pageIsin);
        } else if (requestedIsin != null && !requestedIsin.isBlank()) {
            builder.field(ProductAttribute.ISIN, requestedIsin.trim(), 0.6, SOURCE, requestedIsin.trim());
        }

        putText(builder, ProductAttribute.ISSUER_NAME, labelValue(document, ISSUER_LABELS), 0.6);
        putText(builder, ProductAttribute.CURRENCY, labelValue(document, CURRENCY_LABELS), 0.7);
        Element heading = document.selectFirst("h1");
        if (heading != null) {
            putText(builder, ProductAttribute.PRODUCT_NAME, TextUtils.normalizeWhitespace(heading.text()), 0.6);
        }
        putText(builder, ProductAttribute.PRODUCT_TYPE, labelValue(document, TYPE_LABELS), 0.6);

        String couponText = labelValue(document, COUPON_LABELS);
        if (couponText != null) {
            Matcher matcher = PERCENT.matcher(couponText);
            if (matcher.find()) {
                Double coupon = TextUtils.parseSwissNumber(matcher.group(1));
                putNumber(builder, ProductAttribute.COUPON_RATE_PCT_PA, coupon, 0.8, couponText);
            }
        }

        Underlying underlying = Underlying.empty();
        String barrierText = labelValue(document, BARRIER_LABELS);
        Double barrier = TextUtils.parseSwissNumber(barrierText);
        if (barrier != null) {
            UnderlyingAttribute target = barrierText.contains("%") || barrier <= 100
                ? UnderlyingAttribute.BARRIER_PCT_OF_INITIAL
                : UnderlyingAttribute.BARRIER_LEVEL;
            underlying = underlying.with(target, Field.of(barrier, 0.7, SOURCE, TextUtils.truncateExcerpt(barrierText)));
        }
        String strikeText = labelValue(document, STRIKE_LABELS);
        Double strike = TextUtils.parseSwissNumber(strikeText);
        if (strike != null) {
            underlying = underlying.with(
                UnderlyingAttribute.STRIKE_LEVEL,
                Field.of(strike, 0.7, SOURCE, TextUtils.truncateExcerpt(strikeText))
            );
        }
        if (!underlying.isEmpty()) {
            builder.underlyings(List.of(underlying));
        }

        String capText = labelValue(document, CAP_LABELS);
        putNumber(builder, ProductAttribute.CAP_LEVEL_PCT, TextUtils.parseSwissNumber(capText), 0.7, capText);
        String participationText = labelValue(document, PARTICIPATION_LABELS);
        putNumber(
            builder,
            ProductAttribute.PARTICIPATION_RATE_PCT,
            TextUtils.parseSwissNumber(participationText),
            0.7,
            participationText
        );

        String maturityText = labelValue(document, MATURITY_LABELS);
        putText(builder, ProductAttribute.MATURITY_DATE, TextUtils.swissDateToIso(maturityText), 0.7, maturityText);
        String issueText = labelValue(document, ISSUE_DATE_LABELS);
        putText(builder, ProductAttribute.ISSUE_DATE, TextUtils.swissDateToIso(issueText), 0.7, issueText);
        return builder.build();
    }

    /**
     * Returns the text of the cell following the first cell whose text equals one of the labels.
     */
    static String labelValue(Document document, List<String> labels) {
        Elements cells = document.select("td, th");
        for (String label : labels) {
            String wanted = label.toLowerCase(Locale.ROOT);
            for (Element cell : cells) {
                if (!TextUtils.normalizeWhitespace(cell.text()).toLowerCase(Locale.ROOT).equals(wanted)) {
                    continue;
                }
                Element value = cell.nextElementSibling();
                if (value == null) {
                    continue;
                }
                String text = TextUtils.normalizeWhitespace(value.text());
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    private static void putText(NormalizedProduct.Builder builder, ProductAttribute attribute, String value, double confidence) {
        putText(builder, attribute, value, confidence, value);
    }

    private static void putText(
        NormalizedProduct.Builder builder,
        ProductAttribute attribute,
        String value,
        double confidence,
        String evidence
    ) {
        if (value != null && !value.isBlank()) {
            builder.field(attribute, value, confidence, SOURCE, TextUtils.truncateExcerpt(evidence));
        }
    }

    private static void putNumber(
        NormalizedProduct.Builder builder,
        ProductAttribute attribute,
        Double value,
        double confidence,
        String evidence
    ) {
        if (value != null) {
            builder.field(attribute, value, confidence, SOURCE, TextUtils.truncateExcerpt(evidence));
        }
    }
}
