package com.phillippitts.cvtailor.presentation.dto;

public record RefineRequest(String documentType, String feedback) {
}
