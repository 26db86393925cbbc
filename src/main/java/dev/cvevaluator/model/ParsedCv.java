package dev.cvevaluator.model;

public record ParsedCv(String rawText, CvStructure structure) {
}
