package co.fanki.drivesync.content.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link PandocTextExtractor} and
 * {@link DocumentTextExtractor} without a pandoc binary.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PandocTextExtractorTest {

    @Test
    void whenExtracting_givenMissingBinary_shouldThrowExtractionException() {
        final PandocTextExtractor extractor = new PandocTextExtractor(
                "pandoc-binary-that-does-not-exist", 5);

        final TextExtractionException error = assertThrows(
                TextExtractionException.class,
                () -> extractor.extract(new byte[] {1}));

        assertTrue(error.getMessage().startsWith("Cannot run pandoc"));
        assertEquals(TextExtractionException.EXTRACTION_FAILED,
                error.getErrorCode());
    }

    @Test
    void whenDispatching_givenCsv_shouldUseCsvExtractor() {
        final DocumentTextExtractor extractor = new DocumentTextExtractor(
                new PandocTextExtractor("pandoc-binary-that-does-not-exist", 5),
                new PdfTextExtractor(),
                new CsvTextExtractor());

        assertEquals("| a   |\n| --- |", extractor.extract(
                "a\n".getBytes(java.nio.charset.StandardCharsets.UTF_8),
                DocumentFormat.CSV));
    }

}
