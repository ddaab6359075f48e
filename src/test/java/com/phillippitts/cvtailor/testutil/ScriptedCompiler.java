package com.phillippitts.cvtailor.testutil;

import com.phillippitts.cvtailor.exception.CompileException;
import com.phillippitts.cvtailor.service.compiler.CompiledDocument;
import com.phillippitts.cvtailor.service.compiler.DocumentCompiler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Compiler double returning scripted page counts or compile errors, in order.
 *
 * <p>The "PDF" bytes are {@code PDF:<pages>:<source>} so tests can tell which source produced
 * a stored artifact. Every compiled source text is recorded.
 */
public class ScriptedCompiler implements DocumentCompiler {

    private final Deque<Object> outcomes = new ArrayDeque<>();
    private final List<String> sources = new CopyOnWriteArrayList<>();
    private Integer fallbackPages;

    public synchronized ScriptedCompiler pages(int... pageCounts) {
        for (int pages : pageCounts) {
            outcomes.add(pages);
        }
        return this;
    }

    public synchronized ScriptedCompiler error(String diagnostics) {
        outcomes.add(new CompileException("pdflatex produced no PDF", "pdflatex", diagnostics));
        return this;
    }

    public synchronized ScriptedCompiler always(int pages) {
        this.fallbackPages = pages;
        return this;
    }

    @Override
    public synchronized CompiledDocument compile(Path sourceFile) {
        String source;
        try {
            source = Files.readString(sourceFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        sources.add(source);
        Object next = outcomes.poll();
        if (next == null) {
            next = fallbackPages;
        }
        if (next == null) {
            throw new IllegalStateException("No scripted compile outcome");
        }
        if (next instanceof CompileException error) {
            throw error;
        }
        int pages = (Integer) next;
        return new CompiledDocument(pages, pdfBytes(pages, source));
    }

    public static byte[] pdfBytes(int pages, String source) {
        return ("PDF:" + pages + ":" + source).getBytes(StandardCharsets.UTF_8);
    }

    public List<String> sources() {
        return List.copyOf(sources);
    }
}
