package com.phillippitts.cvtailor.domain;

public enum ChatRole {
    USER,
    ASSISTANT
}
