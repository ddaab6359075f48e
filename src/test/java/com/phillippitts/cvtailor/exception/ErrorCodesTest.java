package com.phillippitts.cvtailor.exception;

import com.phillippitts.cvtailor.domain.DocumentType;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorCodesTest {

    @Test
    void shouldMapEachFailureToStableCode() {
        assertThat(ErrorCodes.of(new InputInvalidException("blank"))).isEqualTo("INPUT_INVALID");
        assertThat(ErrorCodes.of(new SessionNotFoundException("s"))).isEqualTo("SESSION_NOT_FOUND");
        assertThat(ErrorCodes.of(new ArtifactNotFoundException("s", DocumentType.CV))).isEqualTo("ARTIFACT_NOT_FOUND");
        assertThat(ErrorCodes.of(new SessionLockedException("s"))).isEqualTo("SESSION_LOCKED");
        assertThat(ErrorCodes.of(new ConcurrentSessionModificationException("s"))).isEqualTo("SESSION_BUSY");
        assertThat(ErrorCodes.of(new UpstreamFetchException("u", "r"))).isEqualTo("UPSTREAM_FETCH_FAILED");
        assertThat(ErrorCodes.of(new TransientBackendException("x", 503)))
                .isEqualTo("GENERATION_BACKEND_UNAVAILABLE");
        assertThat(ErrorCodes.of(new PermanentBackendException("x"))).isEqualTo("GENERATION_BACKEND_UNAVAILABLE");
        assertThat(ErrorCodes.of(new CompileException("x", "pdflatex", ""))).isEqualTo("COMPILE_FAILED");
        assertThat(ErrorCodes.of(new StorageException("x", "p", new IOException()))).isEqualTo("STORAGE_FAILED");
    }

    @Test
    void shouldFallBackToInternalError() {
        assertThat(ErrorCodes.of(new IllegalStateException("bug"))).isEqualTo("INTERNAL_ERROR");
        assertThat(ErrorCodes.of(new CvTailorException("generic"))).isEqualTo("INTERNAL_ERROR");
    }
}
