package dev.cvevaluator.model;

public record ParsedProject(String rawText, ProjectStructure structure) {
}
