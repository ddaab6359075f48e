package com.phillippitts.cvtailor.service.compiler;

import com.phillippitts.cvtailor.config.properties.CompilerProperties;
import com.phillippitts.cvtailor.exception.CompileException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static com.phillippitts.cvtailor.service.compiler.CompilerTestDoubles.ProcessBehavior;
import static com.phillippitts.cvtailor.service.compiler.CompilerTestDoubles.ScriptedProcessFactory;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfTextExtractorTest {

    private static final CompilerProperties PROPS =
            new CompilerProperties(null, null, "pdftotext", Duration.ofSeconds(2), null);

    @Test
    void shouldReturnTrimmedText() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory()
                .on("pdftotext", ProcessBehavior.exits(0, "  Jane Doe\nEngineer  "));
        PdfTextExtractor extractor = new PdfTextExtractor(new ProcessRunner(factory, 4096), PROPS);

        String text = extractor.extractText("%PDF".getBytes(StandardCharsets.UTF_8));

        assertThat(text).isEqualTo("Jane Doe\nEngineer");
        List<String> command = factory.commands().get(0);
        assertThat(command.get(0)).isEqualTo("pdftotext");
        assertThat(command.get(2)).isEqualTo("-");
        assertThat(Files.exists(Path.of(command.get(1)))).isFalse();
    }

    @Test
    void shouldFailOnNonZeroExit() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory()
                .on("pdftotext", ProcessBehavior.fails("Syntax Error"));
        PdfTextExtractor extractor = new PdfTextExtractor(new ProcessRunner(factory, 4096), PROPS);

        assertThatThrownBy(() -> extractor.extractText(new byte[] {1, 2}))
                .isInstanceOf(CompileException.class)
                .hasMessageContaining("Text extraction failed");
    }
}
