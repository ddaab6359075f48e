package com.phillippitts.cvtailor.service.health;

import com.phillippitts.cvtailor.config.properties.CompilerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Health indicator for the document toolchain (pdflatex, pdfinfo, pdftotext).
 *
 * <ul>
 *   <li>UP: all binaries resolve</li>
 *   <li>DEGRADED: pdflatex and pdfinfo resolve but pdftotext does not (text extraction
 *       falls back to the LaTeX source)</li>
 *   <li>DOWN: pdflatex or pdfinfo is missing, so no CV can be compiled</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CompilerHealthIndicator implements HealthIndicator {

    private final CompilerProperties properties;
    private final Predicate<String> binaryResolver;

    @Autowired
    public CompilerHealthIndicator(CompilerProperties properties) {
        this(properties, CompilerHealthIndicator::isExecutableOnPath);
    }

    CompilerHealthIndicator(CompilerProperties properties, Predicate<String> binaryResolver) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.binaryResolver = Objects.requireNonNull(binaryResolver, "binaryResolver must not be null");
    }

    @Override
    public Health health() {
        boolean latex = binaryResolver.test(properties.getLatexBinary());
        boolean pageInfo = binaryResolver.test(properties.getPageInfoBinary());
        boolean text = binaryResolver.test(properties.getTextBinary());

        Health.Builder builder = new Health.Builder();
        if (latex && pageInfo && text) {
            builder.up().withDetail("status", "Toolchain available");
        } else if (latex && pageInfo) {
            builder.status("DEGRADED").withDetail("status", "Text extraction unavailable");
        } else {
            builder.down().withDetail("status", "CV compilation unavailable");
        }
        return builder
                .withDetail("pdflatex", describe(latex))
                .withDetail("pdfinfo", describe(pageInfo))
                .withDetail("pdftotext", describe(text))
                .build();
    }

    private static String describe(boolean available) {
        return available ? "found" : "missing";
    }

    static boolean isExecutableOnPath(String binary) {
        if (binary == null || binary.isBlank()) {
            return false;
        }
        if (binary.contains(File.separator)) {
            return Files.isExecutable(Path.of(binary));
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (!dir.isBlank() && Files.isExecutable(Path.of(dir, binary))) {
                return true;
            }
        }
        return false;
    }
}
