package com.phillippitts.cvtailor.domain;

import java.util.List;
import java.util.Objects;

/**
 * Resolved job posting: the plain-text description plus the fields extracted from it.
 *
 * @param sourceUrl link the description was fetched from, or {@code null} for pasted text
 */
public record JobContext(
        String jobDescription,
        String companyName,
        String jobTitle,
        List<String> emailAddresses,
        String sourceUrl
) {
    public static final String UNKNOWN_COMPANY = "Unknown Company";
    public static final String UNKNOWN_TITLE = "Unknown Position";

    public JobContext {
        Objects.requireNonNull(jobDescription, "jobDescription must not be null");
        companyName = blankToDefault(companyName, UNKNOWN_COMPANY);
        jobTitle = blankToDefault(jobTitle, UNKNOWN_TITLE);
        emailAddresses = emailAddresses == null ? List.of() : List.copyOf(emailAddresses);
    }

    public static JobContext of(String jobDescription, String companyName, String jobTitle) {
        return new JobContext(jobDescription, companyName, jobTitle, List.of(), null);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
