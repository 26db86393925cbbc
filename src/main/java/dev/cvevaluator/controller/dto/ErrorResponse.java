package dev.cvevaluator.controller.dto;

public record ErrorResponse(String error, String message) {
}
