package com.phillippitts.cvtailor.service.compiler;

import java.util.Objects;

/**
 * A successfully compiled PDF and its measured page count.
 */
public record CompiledDocument(int pageCount, byte[] bytes) {

    public CompiledDocument {
        if (pageCount < 0) {
            throw new IllegalArgumentException("pageCount must be >= 0");
        }
        Objects.requireNonNull(bytes, "bytes must not be null");
    }
}
