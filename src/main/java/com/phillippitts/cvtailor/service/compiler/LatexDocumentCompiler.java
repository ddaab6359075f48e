package com.phillippitts.cvtailor.service.compiler;

import com.phillippitts.cvtailor.config.properties.CompilerProperties;
import com.phillippitts.cvtailor.exception.CompileExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles LaTeX with {@code pdflatex} and counts pages with {@code pdfinfo}.
 *
 * <p>pdflatex runs with {@code -interaction=nonstopmode}; a non-zero exit is tolerated as long as
 * a PDF was written. Any PDF left by a previous attempt is removed first, so a failed compile
 * can never be measured against stale output.
 */
@Component
public class LatexDocumentCompiler implements DocumentCompiler {

    private static final Logger LOG = LogManager.getLogger(LatexDocumentCompiler.class);

    private static final Pattern PAGES = Pattern.compile("(?m)^Pages:\\s+(\\d+)");
    private static final int MAX_DIAGNOSTIC_CHARS = 2_000;
    private static final int TAIL_LINES = 20;

    private final ProcessRunner runner;
    private final CompilerProperties properties;

    @Autowired
    public LatexDocumentCompiler(CompilerProperties properties) {
        this(new ProcessRunner(new DefaultProcessFactory(), properties.getMaxOutputChars()), properties);
    }

    LatexDocumentCompiler(ProcessRunner runner, CompilerProperties properties) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public CompiledDocument compile(Path source) {
        Objects.requireNonNull(source, "source must not be null");
        Path absolute = source.toAbsolutePath();
        Path dir = absolute.getParent();
        Path pdf = dir.resolve(baseName(absolute) + ".pdf");
        deleteStale(pdf);

        List<String> command = List.of(properties.getLatexBinary(), "-interaction=nonstopmode",
                "-output-directory", dir.toString(), absolute.toString());
        ProcessResult latex = runner.run("pdflatex", command, dir, properties.getTimeout());

        if (!Files.exists(pdf)) {
            throw CompileExceptionBuilder.create("LaTeX compilation produced no PDF")
                    .tool("pdflatex")
                    .exitCode(latex.exitCode())
                    .durationMs(latex.durationMs())
                    .diagnostics(extractDiagnostics(latex.stdout()))
                    .metadata("source", absolute.getFileName())
                    .build();
        }
        if (!latex.succeeded()) {
            LOG.warn("pdflatex exited {} but produced {}", latex.exitCode(), pdf.getFileName());
        }

        int pages = countPages(pdf);
        try {
            return new CompiledDocument(pages, Files.readAllBytes(pdf));
        } catch (IOException e) {
            throw CompileExceptionBuilder.create("Failed to read compiled PDF")
                    .tool("pdflatex")
                    .cause(e)
                    .metadata("file", pdf.getFileName())
                    .build();
        }
    }

    /**
     * Reads the page count reported by {@code pdfinfo}.
     */
    int countPages(Path pdf) {
        ProcessResult info = runner.run("pdfinfo",
                List.of(properties.getPageInfoBinary(), pdf.toString()), pdf.getParent(), properties.getTimeout());
        if (!info.succeeded()) {
            throw CompileExceptionBuilder.create("Failed to read PDF page count")
                    .tool("pdfinfo")
                    .exitCode(info.exitCode())
                    .durationMs(info.durationMs())
                    .diagnostics(info.stderr())
                    .build();
        }
        Matcher matcher = PAGES.matcher(info.stdout());
        if (!matcher.find()) {
            throw CompileExceptionBuilder.create("pdfinfo output has no page count")
                    .tool("pdfinfo")
                    .diagnostics(info.stdout())
                    .build();
        }
        return Integer.parseInt(matcher.group(1));
    }

    /**
     * Picks the LaTeX error lines ({@code !} lines and the {@code l.N} context after them),
     * falling back to the tail of the log when none are present.
     */
    static String extractDiagnostics(String log) {
        if (log == null || log.isBlank()) {
            return "";
        }
        String[] lines = log.split("\\R");
        List<String> picked = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].startsWith("!")) {
                picked.add(lines[i]);
                for (int j = i + 1; j < Math.min(lines.length, i + 4); j++) {
                    if (lines[j].startsWith("l.")) {
                        picked.add(lines[j]);
                        break;
                    }
                }
            }
        }
        if (picked.isEmpty()) {
            for (int i = Math.max(0, lines.length - TAIL_LINES); i < lines.length; i++) {
                picked.add(lines[i]);
            }
        }
        String joined = String.join("\n", picked);
        return joined.length() <= MAX_DIAGNOSTIC_CHARS ? joined : joined.substring(0, MAX_DIAGNOSTIC_CHARS);
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void deleteStale(Path pdf) {
        try {
            Files.deleteIfExists(pdf);
        } catch (IOException e) {
            throw CompileExceptionBuilder.create("Cannot remove previous PDF")
                    .tool("pdflatex")
                    .cause(e)
                    .metadata("file", pdf.getFileName())
                    .build();
        }
    }
}
