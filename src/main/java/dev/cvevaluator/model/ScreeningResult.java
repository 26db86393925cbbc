package dev.cvevaluator.model;

import java.util.List;

/**
 * Block/allow verdict from the content-safety screener.
 */
public record ScreeningResult(boolean blocked, List<String> reasons, List<String> categories) {

    public ScreeningResult {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
        categories = categories != null ? List.copyOf(categories) : List.of();
    }

    public static ScreeningResult allowed() {
        return new ScreeningResult(false, List.of(), List.of());
    }

    public static ScreeningResult blocked(List<String> reasons) {
        return new ScreeningResult(true, reasons, reasons);
    }
}
