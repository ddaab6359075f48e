package com.phillippitts.cvtailor.util;

import com.phillippitts.cvtailor.domain.DocumentType;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Builds descriptive artifact file names of the form
 * {@code YYYY-MM-DD_Company_Title_Owner_Type.ext}.
 */
public final class ArtifactNaming {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final int MAX_PART_LENGTH = 24;

    private ArtifactNaming() {
    }

    public static String fileName(LocalDate date, String company, String title, String owner,
                                  DocumentType type, String extension) {
        return DATE.format(date)
                + "_" + sanitize(company)
                + "_" + sanitize(title)
                + "_" + sanitize(owner)
                + "_" + type.fileLabel()
                + "." + extension;
    }

    /**
     * Replaces every run of non-alphanumeric characters with a single underscore and caps the
     * length. Returns {@code "Unknown"} for values that sanitize to nothing.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "Unknown";
        }
        String cleaned = value.replaceAll("[^A-Za-z0-9]+", "_").replaceAll("^_+|_+$", "");
        if (cleaned.length() > MAX_PART_LENGTH) {
            cleaned = cleaned.substring(0, MAX_PART_LENGTH).replaceAll("_+$", "");
        }
        return cleaned.isEmpty() ? "Unknown" : cleaned;
    }
}
