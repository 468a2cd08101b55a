package com.nevis.reports.service;

import com.nevis.reports.PdfFixtures;
import com.nevis.reports.exception.DocumentNotFoundException;
import com.nevis.reports.exception.EntityNotFoundException;
import com.nevis.reports.exception.PathTraversalRejectedException;
import com.nevis.reports.exception.RootMissingException;
import com.nevis.reports.model.DocumentDetail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentServiceTest {

    private static final Instant JAN = Instant.parse("2024-01-05T00:00:00Z");

    @TempDir
    Path workspace;

    private Path root;
    private DocumentServiceImpl documentService;
    private byte[] q1Bytes;

    @BeforeEach
    void setUp() throws IOException {
        root = workspace.resolve("reports");
        PdfFixtures.writePdf(root.resolve("financial_reports/Q1.pdf"), JAN, "Revenue grew 10%", "");
        Files.writeString(root.resolve("financial_reports/notes.txt"), "plain text");
        Files.writeString(workspace.resolve("secret.pdf"), "outside the root");
        q1Bytes = Files.readAllBytes(root.resolve("financial_reports/Q1.pdf"));

        documentService = new DocumentServiceImpl(new ReportsRoot(root), new MetadataResolver(), new PdfTextExtractor());
    }

    @Nested
    @DisplayName("Fetching bytes")
    class FetchTests {

        @Test
        void shouldReturnOriginalBytes() {
            assertThat(documentService.fetchBytes("financial_reports", "Q1.pdf")).isEqualTo(q1Bytes);
        }

        @Test
        void shouldReportMissingDocumentAsNotFound() {
            assertThatThrownBy(() -> documentService.fetchBytes("financial_reports", "Q9.pdf"))
                .isInstanceOf(DocumentNotFoundException.class)
                .hasMessage("Document not found: financial_reports/Q9.pdf");
        }

        @Test
        void shouldRefuseNonPdfFiles() {
            assertThatThrownBy(() -> documentService.fetchBytes("financial_reports", "notes.txt"))
                .isInstanceOf(DocumentNotFoundException.class);
        }

        @Test
        void shouldRefuseDirectoryNamedLikePdf() throws IOException {
            Files.createDirectories(root.resolve("financial_reports/archive.pdf"));

            assertThatThrownBy(() -> documentService.fetchBytes("financial_reports", "archive.pdf"))
                .isInstanceOf(DocumentNotFoundException.class);
        }

        @Test
        void shouldFailWhenRootIsMissing() {
            DocumentServiceImpl broken = new DocumentServiceImpl(
                new ReportsRoot(workspace.resolve("nowhere")), new MetadataResolver(), new PdfTextExtractor());

            assertThatThrownBy(() -> broken.fetchBytes("financial_reports", "Q1.pdf"))
                .isInstanceOf(RootMissingException.class);
        }
    }

    @Nested
    @DisplayName("Path traversal")
    class TraversalTests {

        @ParameterizedTest
        @CsvSource({
            "'..', 'secret.pdf'",
            "'..', 'x.pdf'",
            "'financial_reports', '../../etc/passwd'",
            "'financial_reports', '../Q1.pdf'",
            "'.', 'Q1.pdf'",
            "'financial_reports/..', 'secret.pdf'",
            "'/etc', 'passwd.pdf'",
            "'financial_reports', '/etc/passwd.pdf'",
            "'financial_reports', '..\\secret.pdf'",
            "'', 'Q1.pdf'",
            "'financial_reports', '   '"
        })
        void shouldRejectNamesEscapingRoot(String folder, String filename) {
            assertThatThrownBy(() -> documentService.fetchBytes(folder, filename))
                .isInstanceOf(PathTraversalRejectedException.class)
                .isInstanceOf(EntityNotFoundException.class);
        }

        @Test
        void shouldRejectSymlinkedFolderPointingOutsideRoot() throws IOException {
            Path outside = workspace.resolve("outside");
            PdfFixtures.writePdf(outside.resolve("leak.pdf"), JAN, "secret");
            Files.createSymbolicLink(root.resolve("linked"), outside);

            assertThatThrownBy(() -> documentService.fetchBytes("linked", "leak.pdf"))
                .isInstanceOf(PathTraversalRejectedException.class);
        }
    }

    @Nested
    @DisplayName("Document detail")
    class DetailTests {

        @Test
        void shouldReturnMetadataAndPages() {
            DocumentDetail detail = documentService.getDocument("financial_reports", "Q1.pdf");

            assertThat(detail.document().getFilename()).isEqualTo("Q1.pdf");
            assertThat(detail.document().getFolder()).isEqualTo("financial_reports");
            assertThat(detail.document().getSizeBytes()).isEqualTo(q1Bytes.length);
            assertThat(detail.document().getModifiedAt().toInstant()).isEqualTo(JAN);
            assertThat(detail.pageCount()).isEqualTo(2);
            assertThat(detail.textContent()).isEqualTo("Revenue grew 10%");
        }

        @Test
        void shouldReportMissingDocumentAsNotFound() {
            assertThatThrownBy(() -> documentService.getDocument("financial_reports", "missing.pdf"))
                .isInstanceOf(DocumentNotFoundException.class);
        }
    }
}
