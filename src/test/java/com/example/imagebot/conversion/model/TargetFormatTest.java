package com.example.imagebot.conversion.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TargetFormatTest {

    @Test
    void resolvesTokensIgnoringCase() {
        assertThat(TargetFormat.fromToken("webp")).contains(TargetFormat.WEBP);
        assertThat(TargetFormat.fromToken(" Jpeg ")).contains(TargetFormat.JPEG);
        assertThat(TargetFormat.fromToken("jpg")).isEmpty();
        assertThat(TargetFormat.fromToken("")).isEmpty();
    }

    @Test
    void usesShortJpegExtension() {
        assertThat(TargetFormat.JPEG.extension()).isEqualTo(".jpg");
        assertThat(TargetFormat.TIFF.extension()).isEqualTo(".tiff");
    }

    @Test
    void callbackDataCarriesLowercaseToken() {
        assertThat(FormatChoice.of(TargetFormat.AVIF)).isEqualTo(new FormatChoice("AVIF", "convert_avif"));
    }

    @Test
    void statisticsScopeDefaultsToAllTime() {
        assertThat(StatisticsScope.fromArgument("TODAY")).isEqualTo(StatisticsScope.TODAY);
        assertThat(StatisticsScope.fromArgument("month")).isEqualTo(StatisticsScope.MONTH);
        assertThat(StatisticsScope.fromArgument("yesterday")).isEqualTo(StatisticsScope.ALL);
        assertThat(StatisticsScope.fromArgument(null)).isEqualTo(StatisticsScope.ALL);
    }
}
