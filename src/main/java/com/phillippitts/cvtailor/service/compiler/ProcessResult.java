package com.phillippitts.cvtailor.service.compiler;

/**
 * Captured outcome of one external tool invocation.
 */
public record ProcessResult(int exitCode, String stdout, String stderr, long durationMs) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
