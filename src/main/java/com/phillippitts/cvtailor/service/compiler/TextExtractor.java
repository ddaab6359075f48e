package com.phillippitts.cvtailor.service.compiler;

import com.phillippitts.cvtailor.exception.CompileException;

/**
 * Extracts plain text from a compiled document.
 */
public interface TextExtractor {

    /**
     * @throws CompileException if extraction fails
     */
    String extractText(byte[] pdf);
}
