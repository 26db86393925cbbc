package dev.cvevaluator.document;

import dev.cvevaluator.entity.CandidateDocument;
import dev.cvevaluator.model.DocumentType;
import dev.cvevaluator.model.ParsedContent;
import org.springframework.util.unit.DataSize;

/**
 * Access to uploaded documents and their cached extracted text.
 */
public interface DocumentStore {

    /**
     * @throws dev.cvevaluator.exception.DocumentNotFoundException if no document has this id
     */
    CandidateDocument get(String documentId);

    /**
     * Raw bytes of the stored file.
     *
     * @throws dev.cvevaluator.exception.ValidationException if the file is missing or unreadable
     */
    byte[] readContent(CandidateDocument document);

    void cacheParsedContent(String documentId, ParsedContent content);

    CandidateDocument register(DocumentType type, String filename, String storagePath, long fileSize, String mimeType);

    /**
     * Largest accepted upload.
     */
    DataSize getMaxFileSize();

    /**
     * Check an upload without storing it.
     *
     * @throws dev.cvevaluator.exception.ValidationException if the file is empty, too large or not a PDF
     */
    void validateUpload(String originalFilename, byte[] content);

    /**
     * Store an uploaded candidate file and register it.
     *
     * @throws dev.cvevaluator.exception.ValidationException if the file is not acceptable
     */
    CandidateDocument upload(DocumentType type, String originalFilename, byte[] content);
}
