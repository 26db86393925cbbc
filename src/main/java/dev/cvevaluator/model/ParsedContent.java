package dev.cvevaluator.model;

public record ParsedContent(String text, int pages) {

    public ParsedContent {
        text = text != null ? text : "";
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
