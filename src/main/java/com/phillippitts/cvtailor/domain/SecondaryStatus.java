package com.phillippitts.cvtailor.domain;

public enum SecondaryStatus {
    GENERATED,
    SKIPPED,
    FAILED
}
