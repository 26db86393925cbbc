package dev.cvevaluator.exception;

import java.io.Serial;

public class DocumentNotFoundException extends EvaluationException {

    @Serial
    private static final long serialVersionUID = -1931906237510371548L;

    public static final String CODE = "DOCUMENT_NOT_FOUND";

    public DocumentNotFoundException(String documentId) {
        super(CODE, "Document not found: " + documentId);
    }
}
