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
import java.util.List;
import java.util.Objects;

/**
 * Extracts text with {@code pdftotext file -} from a temporary copy of the PDF.
 */
@Component
public class PdfTextExtractor implements TextExtractor {

    private static final Logger LOG = LogManager.getLogger(PdfTextExtractor.class);

    private final ProcessRunner runner;
    private final CompilerProperties properties;

    @Autowired
    public PdfTextExtractor(CompilerProperties properties) {
        this(new ProcessRunner(new DefaultProcessFactory(), properties.getMaxOutputChars()), properties);
    }

    PdfTextExtractor(ProcessRunner runner, CompilerProperties properties) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public String extractText(byte[] pdf) {
        Objects.requireNonNull(pdf, "pdf must not be null");
        Path temp = null;
        try {
            temp = Files.createTempFile("cv-tailor-", ".pdf");
            Files.write(temp, pdf);
            ProcessResult result = runner.run("pdftotext",
                    List.of(properties.getTextBinary(), temp.toString(), "-"), temp.getParent(),
                    properties.getTimeout());
            if (!result.succeeded()) {
                throw CompileExceptionBuilder.create("Text extraction failed")
                        .tool("pdftotext")
                        .exitCode(result.exitCode())
                        .durationMs(result.durationMs())
                        .diagnostics(result.stderr())
                        .build();
            }
            return result.stdout().trim();
        } catch (IOException e) {
            throw CompileExceptionBuilder.create("Cannot stage PDF for text extraction")
                    .tool("pdftotext")
                    .cause(e)
                    .build();
        } finally {
            cleanupTempFile(temp);
        }
    }

    private static void cleanupTempFile(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp file {}: {}", temp, e.toString());
        }
    }
}
