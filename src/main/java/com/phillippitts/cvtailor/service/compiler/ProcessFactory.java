package com.phillippitts.cvtailor.service.compiler;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so tool invocations can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a fake {@link Process}
 * with controlled stdout, stderr and exit behavior.
 */
interface ProcessFactory {

    /**
     * @param command    full command line, executable first
     * @param workingDir working directory for the process (may be null)
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
