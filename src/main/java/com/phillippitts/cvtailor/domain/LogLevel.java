package com.phillippitts.cvtailor.domain;

public enum LogLevel {
    INFO,
    SUCCESS,
    WARN,
    ERROR
}
