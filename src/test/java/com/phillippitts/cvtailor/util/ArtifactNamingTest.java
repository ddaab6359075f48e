package com.phillippitts.cvtailor.util;

import com.phillippitts.cvtailor.domain.DocumentType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactNamingTest {

    @Test
    void shouldBuildDescriptiveFileName() {
        String name = ArtifactNaming.fileName(LocalDate.of(2025, 3, 14), "Acme Corp.", "Sr. Engineer (Java)",
                "alice", DocumentType.COVER_LETTER, "txt");

        assertThat(name).isEqualTo("2025-03-14_Acme_Corp_Sr_Engineer_Java_alice_CoverLetter.txt");
    }

    @Test
    void shouldUsePlaceholderForEmptyParts() {
        assertThat(ArtifactNaming.sanitize(null)).isEqualTo("Unknown");
        assertThat(ArtifactNaming.sanitize(" --- ")).isEqualTo("Unknown");
    }

    @Test
    void shouldCapLongPartsWithoutTrailingSeparator() {
        String sanitized = ArtifactNaming.sanitize("International Business Machines Corporation");

        assertThat(sanitized).hasSizeLessThanOrEqualTo(24).doesNotEndWith("_");
        assertThat(sanitized).startsWith("International_Business");
    }
}
