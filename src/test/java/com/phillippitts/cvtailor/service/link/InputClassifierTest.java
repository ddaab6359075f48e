package com.phillippitts.cvtailor.service.link;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class InputClassifierTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "https://jobs.acme.com/123",
            "http://example.org",
            "  HTTPS://Jobs.Acme.com/apply?id=7  "
    })
    void shouldRecognizeLinks(String input) {
        assertThat(InputClassifier.isUrl(input)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "Senior engineer at Acme",
            "ftp://files.acme.com/job.txt",
            "https://jobs.acme.com/123 and more text",
            "https://",
            "see https://jobs.acme.com"
    })
    void shouldTreatEverythingElseAsDescription(String input) {
        assertThat(InputClassifier.isUrl(input)).isFalse();
    }
}
