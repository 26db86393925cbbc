package dev.cvevaluator.document;

import dev.cvevaluator.config.StorageProperties;
import dev.cvevaluator.entity.CandidateDocument;
import dev.cvevaluator.exception.DocumentNotFoundException;
import dev.cvevaluator.exception.ValidationException;
import dev.cvevaluator.model.DocumentType;
import dev.cvevaluator.model.ParsedContent;
import dev.cvevaluator.repository.CandidateDocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentServiceTest {

    private static final byte[] PDF = "%PDF-1.7\n1 0 obj\n".getBytes(StandardCharsets.US_ASCII);

    @Mock
    private CandidateDocumentRepository documentRepository;

    @TempDir
    Path uploadDir;

    private StorageProperties storageProperties;
    private DocumentService documentService;

    @BeforeEach
    void setUp() {
        storageProperties = new StorageProperties();
        storageProperties.setUploadDir(uploadDir.toString());
        documentService = new DocumentService(documentRepository, storageProperties);
    }

    @Nested
    @DisplayName("Upload")
    class UploadTests {

        @Test
        @DisplayName("Should store the file and register it with a typed id")
        void shouldStoreAndRegister() throws IOException {
            when(documentRepository.save(any(CandidateDocument.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0));

            CandidateDocument document = documentService.upload(DocumentType.CV, "resume.pdf", PDF);

            assertThat(document.getId()).startsWith("cv_");
            assertThat(document.getType()).isEqualTo(DocumentType.CV);
            assertThat(document.getFilename()).isEqualTo("resume.pdf");
            assertThat(document.getMimeType()).isEqualTo("application/pdf");
            assertThat(document.getFileSize()).isEqualTo(PDF.length);
            assertThat(document.hasParsedContent()).isFalse();
            assertThat(Files.readAllBytes(Path.of(document.getStoragePath()))).isEqualTo(PDF);
        }

        @Test
        @DisplayName("Should reject an empty file")
        void shouldRejectEmptyFile() {
            assertThatThrownBy(() -> documentService.upload(DocumentType.CV, "empty.pdf", new byte[0]))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("empty");
            verifyNoInteractions(documentRepository);
        }

        @Test
        @DisplayName("Should reject a file that is not a PDF")
        void shouldRejectNonPdf() {
            byte[] docx = "PK\u0003\u0004word/document.xml".getBytes(StandardCharsets.ISO_8859_1);

            assertThatThrownBy(() -> documentService.upload(DocumentType.PROJECT_REPORT, "report.docx", docx))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("not a PDF");
        }

        @Test
        @DisplayName("Should reject a file over the size limit")
        void shouldRejectOversizedFile() {
            storageProperties.setMaxFileSize(DataSize.ofBytes(8));

            assertThatThrownBy(() -> documentService.upload(DocumentType.CV, "resume.pdf", PDF))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("exceeds");
        }
    }

    @Nested
    @DisplayName("Read")
    class ReadTests {

        @Test
        @DisplayName("Should throw for unknown document")
        void shouldThrowForUnknownDocument() {
            when(documentRepository.findById("cv_404")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> documentService.get("cv_404"))
                    .isInstanceOf(DocumentNotFoundException.class)
                    .hasMessageContaining("cv_404");
        }

        @Test
        @DisplayName("Should read the stored bytes")
        void shouldReadContent() throws IOException {
            Path file = Files.write(uploadDir.resolve("cv.pdf"), PDF);
            CandidateDocument document = CandidateDocument.builder()
                    .id("cv_1").filename("cv.pdf").storagePath(file.toString()).build();

            assertThat(documentService.readContent(document)).isEqualTo(PDF);
        }

        @Test
        @DisplayName("Should report a missing file as a validation error")
        void shouldRejectMissingFile() {
            CandidateDocument document = CandidateDocument.builder()
                    .id("cv_1").filename("gone.pdf").storagePath(uploadDir.resolve("gone.pdf").toString()).build();

            assertThatThrownBy(() -> documentService.readContent(document))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("gone.pdf");
        }

        @Test
        @DisplayName("Should cache extracted text on the document")
        void shouldCacheParsedContent() {
            CandidateDocument document = CandidateDocument.builder()
                    .id("cv_1").type(DocumentType.CV).filename("cv.pdf").storagePath("/tmp/cv.pdf")
                    .uploadedAt(LocalDateTime.now()).build();
            when(documentRepository.findById("cv_1")).thenReturn(Optional.of(document));

            documentService.cacheParsedContent("cv_1", new ParsedContent("Jane Doe, backend engineer", 2));

            assertThat(document.hasParsedContent()).isTrue();
            assertThat(document.getPageCount()).isEqualTo(2);
            assertThat(document.getParsedAt()).isNotNull();
            verify(documentRepository).save(document);
        }
    }
}
