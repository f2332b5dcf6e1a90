package com.odata.writer.request;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import com.odata.writer.format.PayloadFormat;

import static org.assertj.core.api.Assertions.*;

class WriterSettingsTest {

    @ParameterizedTest
    @CsvSource({
            "https://host/svc/, Orders(1), https://host/svc/Orders(1)",
            "https://host/svc,  Orders(1), https://host/svc/Orders(1)",
            "https://host/svc/, /Orders,   https://host/svc/Orders",
            "https://host/svc,  /Orders,   https://host/svc/Orders",
    })
    void testResolve(String urlBase, String commandText, String expected) {
        WriterSettings settings = WriterSettings.builder().urlBase(urlBase).build();

        assertThat(settings.resolve(commandText)).isEqualTo(expected);
    }

    @Test
    void testResolveWithoutUrlBase() {
        WriterSettings settings = WriterSettings.builder().build();

        assertThat(settings.resolve("Orders")).isEqualTo("Orders");
    }

    @Test
    void testDefaults() {
        WriterSettings settings = WriterSettings.builder().build();

        assertThat(settings.getPayloadFormat()).isEqualTo(PayloadFormat.JSON);
        assertThat(settings.isIndent()).isFalse();
        assertThat(settings.getPluralizer()).isNotNull();
    }
}
