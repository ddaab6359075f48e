package com.phillippitts.cvtailor.service.storage;

import com.phillippitts.cvtailor.exception.InputInvalidException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoragePathsTest {

    @Test
    void shouldNamespaceEverythingPerOwner() {
        assertThat(StoragePaths.source("alice", "original_cv.tex")).isEqualTo("users/alice/sources/original_cv.tex");
        assertThat(StoragePaths.sessionFile("alice", "s1")).isEqualTo("users/alice/sessions/s1/session.json");
        assertThat(StoragePaths.logFile("alice", "s1")).isEqualTo("users/alice/sessions/s1/log.json");
        assertThat(StoragePaths.generated("alice", "s1", "cv.pdf"))
                .isEqualTo("users/alice/sessions/s1/generated/cv.pdf");
    }

    @Test
    void shouldAcceptEmailStyleOwnerIds() {
        assertThat(StoragePaths.sessionsDir("alice@example.com")).isEqualTo("users/alice@example.com/sessions");
    }

    @ParameterizedTest
    @ValueSource(strings = {"..", "../bob", "a/b", "", ".hidden", "a..b"})
    void shouldRejectUnsafeSegments(String segment) {
        assertThatThrownBy(() -> StoragePaths.sessionDir("alice", segment))
                .isInstanceOf(InputInvalidException.class);
    }

    @Test
    void shouldRejectNullOwner() {
        assertThatThrownBy(() -> StoragePaths.sessionsDir(null)).isInstanceOf(InputInvalidException.class);
    }
}
