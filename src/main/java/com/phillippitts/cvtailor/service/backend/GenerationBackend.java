package com.phillippitts.cvtailor.service.backend;

import com.phillippitts.cvtailor.exception.PermanentBackendException;
import com.phillippitts.cvtailor.exception.TransientBackendException;

/**
 * Text-generation service used for every generated document and every extraction step.
 *
 * <p>Implementations must be thread-safe; concurrent generation runs share one instance.
 */
public interface GenerationBackend {

    /**
     * Generates text for a rendered prompt.
     *
     * @param prompt prompt kind and its variables
     * @return generated text, never blank
     * @throws TransientBackendException on rate limiting, overload or network timeouts
     * @throws PermanentBackendException on any failure that repeating the call will not fix
     */
    String generate(GenerationPrompt prompt);
}
