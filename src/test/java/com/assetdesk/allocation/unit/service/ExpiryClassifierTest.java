package com.assetdesk.allocation.unit.service;

import com.assetdesk.allocation.service.AlertSeverity;
import com.assetdesk.allocation.service.ExpiryClassifier;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiryClassifierTest {

    @ParameterizedTest
    @CsvSource({
        "-10, EXPIRED",
        "0, EXPIRED",
        "1, CRITICAL",
        "7, CRITICAL",
        "8, WARNING",
        "30, WARNING",
        "31, INFO",
        "365, INFO"
    })
    void classify_boundaries(long days, AlertSeverity expected) {
        assertThat(ExpiryClassifier.classify(days)).isEqualTo(expected);
    }
}
