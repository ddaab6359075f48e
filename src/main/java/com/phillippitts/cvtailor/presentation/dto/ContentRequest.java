package com.phillippitts.cvtailor.presentation.dto;

public record ContentRequest(String content) {
}
