package dev.cvevaluator.entity;

import dev.cvevaluator.model.DocumentType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * An uploaded document. Extracted text is cached here after the first successful extraction.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "documents", indexes = {
        @Index(name = "idx_document_type", columnList = "type")
})
public class CandidateDocument {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private DocumentType type;

    @Column(nullable = false)
    private String filename;

    @Column(nullable = false, length = 1024)
    private String storagePath;

    private long fileSize;

    @Column(length = 100)
    private String mimeType;

    @Column(columnDefinition = "TEXT")
    private String parsedText;

    private Integer pageCount;

    private LocalDateTime parsedAt;

    @Column(nullable = false)
    private LocalDateTime uploadedAt;

    public boolean hasParsedContent() {
        return parsedText != null && !parsedText.isBlank();
    }
}
