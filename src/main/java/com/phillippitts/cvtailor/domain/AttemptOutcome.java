package com.phillippitts.cvtailor.domain;

public enum AttemptOutcome {
    SUCCESS,
    COMPILE_ERROR,
    PAGE_MISMATCH
}
