package com.spa.aggregator.product.parse;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextUtilsTest {

    @Test
    void parsesSwissNumbers() {
        assertThat(TextUtils.parseSwissNumber("1'234.56")).isEqualTo(1234.56);
        assertThat(TextUtils.parseSwissNumber("7,5 %")).isEqualTo(7.5);
        assertThat(TextUtils.parseSwissNumber("n/a")).isNull();
    }

    @Test
    void convertsSwissDates() {
        assertThat(TextUtils.swissDateToIso("Verfall am 1.2.2027")).isEqualTo("2027-02-01");
        assertThat(TextUtils.swissDateToIso("31.02.2027")).isNull();
    }

    @Test
    void truncatesLongExcerpts() {
        String excerpt = TextUtils.truncateExcerpt("x".repeat(500));

        assertThat(excerpt).hasSize(200).endsWith("...");
    }

    @Test
    void findsIsinInText() {
        assertThat(TextUtils.findIsin("ISIN: ch0038863350 / Valor 3886335")).isEqualTo("CH0038863350");
        assertThat(TextUtils.findIsin("no identifier here")).isNull();
    }
}
