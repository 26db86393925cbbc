package dev.cvevaluator.document;

import dev.cvevaluator.config.StorageProperties;
import dev.cvevaluator.entity.CandidateDocument;
import dev.cvevaluator.exception.DocumentNotFoundException;
import dev.cvevaluator.exception.ValidationException;
import dev.cvevaluator.model.DocumentType;
import dev.cvevaluator.model.ParsedContent;
import dev.cvevaluator.repository.CandidateDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Document store over the local file system and the documents table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService implements DocumentStore {

    private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);
    private static final String PDF_MIME_TYPE = "application/pdf";

    private final CandidateDocumentRepository documentRepository;
    private final StorageProperties storageProperties;

    @Override
    @Transactional(readOnly = true)
    public CandidateDocument get(String documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    @Override
    public byte[] readContent(CandidateDocument document) {
        Path path = Path.of(document.getStoragePath());
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            log.error("Failed to read document {} from {}: {}", document.getId(), path, e.getMessage());
            throw new ValidationException("Document file is missing or unreadable: " + document.getFilename());
        }
    }

    @Override
    @Transactional
    public void cacheParsedContent(String documentId, ParsedContent content) {
        CandidateDocument document = get(documentId);
        document.setParsedText(content.text());
        document.setPageCount(content.pages());
        document.setParsedAt(LocalDateTime.now());
        documentRepository.save(document);
        log.debug("Cached {} characters of extracted text for document {}", content.text().length(), documentId);
    }

    @Override
    @Transactional
    public CandidateDocument register(DocumentType type, String filename, String storagePath, long fileSize,
                                      String mimeType) {
        CandidateDocument document = CandidateDocument.builder()
                .id(type.getValue() + "_" + UUID.randomUUID().toString().replace("-", ""))
                .type(type)
                .filename(filename)
                .storagePath(storagePath)
                .fileSize(fileSize)
                .mimeType(mimeType)
                .uploadedAt(LocalDateTime.now())
                .build();
        CandidateDocument saved = documentRepository.save(document);
        log.info("Registered {} document {} ({})", type.getValue(), saved.getId(), filename);
        return saved;
    }

    /**
     * Validate an uploaded PDF, write it to the upload directory and register it.
     * Text extraction is deferred to the evaluation run.
     *
     * @throws ValidationException if the file is empty, too large or not a PDF
     */
    @Override
    @Transactional
    public CandidateDocument upload(DocumentType type, String originalFilename, byte[] content) {
        validateUpload(originalFilename, content);

        Path directory = Path.of(storageProperties.getUploadDir());
        Path target = directory.resolve(type.getValue() + "_" + UUID.randomUUID() + ".pdf");
        try {
            Files.createDirectories(directory);
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store uploaded file " + originalFilename, e);
        }

        return register(type, originalFilename, target.toString(), content.length, PDF_MIME_TYPE);
    }

    @Override
    public DataSize getMaxFileSize() {
        return storageProperties.getMaxFileSize();
    }

    @Override
    public void validateUpload(String filename, byte[] content) {
        if (content == null || content.length == 0) {
            throw new ValidationException("Uploaded file is empty: " + filename);
        }
        if (content.length > storageProperties.getMaxFileSize().toBytes()) {
            throw new ValidationException("Uploaded file exceeds " + storageProperties.getMaxFileSize() + ": " + filename);
        }
        if (content.length < PDF_MAGIC.length) {
            throw new ValidationException("Uploaded file is not a PDF: " + filename);
        }
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (content[i] != PDF_MAGIC[i]) {
                throw new ValidationException("Uploaded file is not a PDF: " + filename);
            }
        }
    }
}
