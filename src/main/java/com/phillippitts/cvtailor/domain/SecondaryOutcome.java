package com.phillippitts.cvtailor.domain;

import java.util.Objects;

public record SecondaryOutcome(DocumentType type, SecondaryStatus status, String content, String path, String error) {

    public SecondaryOutcome {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static SecondaryOutcome generated(DocumentType type, String content, String path) {
        return new SecondaryOutcome(type, SecondaryStatus.GENERATED, content, path, null);
    }

    public static SecondaryOutcome skipped(DocumentType type) {
        return new SecondaryOutcome(type, SecondaryStatus.SKIPPED, null, null, null);
    }

    public static SecondaryOutcome failed(DocumentType type, String error) {
        return new SecondaryOutcome(type, SecondaryStatus.FAILED, null, null, error);
    }
}
