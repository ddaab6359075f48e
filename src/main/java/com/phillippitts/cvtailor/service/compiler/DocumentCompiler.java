package com.phillippitts.cvtailor.service.compiler;

import com.phillippitts.cvtailor.exception.CompileException;

import java.nio.file.Path;

/**
 * Compiles a document source file and measures the output.
 */
public interface DocumentCompiler {

    /**
     * @param source source file inside a scratch workspace; outputs are written next to it
     * @throws CompileException when no PDF is produced or its page count cannot be read
     */
    CompiledDocument compile(Path source);
}
