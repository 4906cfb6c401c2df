package com.spa.aggregator.product.parse;

import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.model.Underlying;
import com.spa.aggregator.product.model.UnderlyingAttribute;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DetailPageParserTest {
    private final DetailPageParser parser = new DetailPageParser();

    private static final String PAGE = """
        <html><body>
          <h1>Barrier Reverse Convertible auf Nestle</h1>
          <table>
            <tr><td>ISIN</td><td>CH1111111116</td></tr>
            <tr><td>Emittent</td><td>UBS AG</td></tr>
            <tr><th>Währung</th><td>CHF</td></tr>
            <tr><td>Kupon</td><td>7,50 % p.a.</td></tr>
            <tr><td>Barriere</td><td>60.00 %</td></tr>
            <tr><td>Cap</td><td>100 %</td></tr>
            <tr><td>Verfall</td><td>15.03.2026</td></tr>
          </table>
        </body></html>
        """;

    @Test
    void extractsLabelledTerms() {
        NormalizedProduct product = parser.parse(PAGE, "CH1111111116");

        assertThat(product.text(ProductAttribute.ISIN).value()).isEqualTo("CH1111111116");
        assertThat(product.text(ProductAttribute.ISSUER_NAME).value()).isEqualTo("UBS AG");
        assertThat(product.text(ProductAttribute.CURRENCY).value()).isEqualTo("CHF");
        assertThat(product.text(ProductAttribute.PRODUCT_NAME).value())
            .isEqualTo("Barrier Reverse Convertible auf Nestle");
        assertThat(product.number(ProductAttribute.COUPON_RATE_PCT_PA).value()).isEqualTo(7.5);
        assertThat(product.number(ProductAttribute.COUPON_RATE_PCT_PA).source()).isEqualTo(DetailPageParser.SOURCE);
        assertThat(product.number(ProductAttribute.CAP_LEVEL_PCT).value()).isEqualTo(100.0);
        assertThat(product.text(ProductAttribute.MATURITY_DATE).value()).isEqualTo("2026-03-15");
        assertThat(product.text(ProductAttribute.MATURITY_DATE).evidence()).isEqualTo("15.03.2026");

        List<Underlying> underlyings = product.underlyings();
        assertThat(underlyings).hasSize(1);
        assertThat(underlyings.get(0).number(UnderlyingAttribute.BARRIER_PCT_OF_INITIAL).value()).isEqualTo(60.0);
        assertThat(product.hasBarrier()).isTrue();
    }

    @Test
    void absoluteBarrierGoesToBarrierLevel() {
        String html = "<table><tr><td>Barriere</td><td>CHF 1'850.50</td></tr></table>";

        NormalizedProduct product = parser.parse(html, "CH1111111116");

        Underlying underlying = product.underlyings().get(0);
        assertThat(underlying.number(UnderlyingAttribute.BARRIER_LEVEL).value()).isEqualTo(1850.5);
        assertThat(underlying.get(UnderlyingAttribute.BARRIER_PCT_OF_INITIAL).isPresent()).isFalse();
    }

    @Test
    void fallsBackToRequestedIsinWithLowerConfidence() {
        NormalizedProduct product = parser.parse("<p>Kein Produkt gefunden</p>", "CH9999999995");

        assertThat(product.text(ProductAttribute.ISIN).value()).isEqualTo("CH9999999995");
        assertThat(product.text(ProductAttribute.ISIN).confidence()).isEqualTo(0.6);
    }

    @Test
    void blankPageYieldsEmptyRecord() {
        assertThat(parser.parse("  ", "CH1111111116").isEmpty()).isTrue();
        assertThat(parser.parse(null, null).isEmpty()).isTrue();
    }

    @Test
    void labelLookupSkipsEmptyValueCells() {
        String html = "<table><tr><td>Emittent</td><td> </td></tr><tr><td>Issuer</td><td>Vontobel</td></tr></table>";

        assertThat(DetailPageParser.labelValue(Jsoup.parse(html), List.of("Emittent", "Issuer"))).isEqualTo("Vontobel");
    }
}
