package co.fanki.drivesync.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GlobPattern}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GlobPatternTest {

    @Test
    void whenMatching_givenStarPattern_shouldMatchAcrossSlashes() {
        final GlobPattern pattern = GlobPattern.of("Archive/*");

        assertTrue(pattern.matches("Archive/2020/report.pdf"));
        assertFalse(pattern.matches("Projects/Archive/report.pdf"));
    }

    @Test
    void whenMatching_givenQuestionMark_shouldMatchOneCharacter() {
        final GlobPattern pattern = GlobPattern.of("draft?.docx");

        assertTrue(pattern.matches("draft1.docx"));
        assertFalse(pattern.matches("draft12.docx"));
    }

    @Test
    void whenMatching_givenCharacterClass_shouldHonorNegation() {
        final GlobPattern pattern = GlobPattern.of("v[!0-9].txt");

        assertTrue(pattern.matches("vx.txt"));
        assertFalse(pattern.matches("v1.txt"));
    }

    @Test
    void whenMatching_givenRegexCharacters_shouldTreatThemLiterally() {
        final GlobPattern pattern = GlobPattern.of("notes (final).md");

        assertTrue(pattern.matches("notes (final).md"));
        assertFalse(pattern.matches("notes final.md"));
    }

    @Test
    void whenMatching_givenUnterminatedBracket_shouldMatchLiteralBracket() {
        assertTrue(GlobPattern.of("a[b").matches("a[b"));
    }

    @Test
    void whenComparing_givenSameGlob_shouldBeEqual() {
        assertEquals(GlobPattern.of("*.tmp"), GlobPattern.of("*.tmp"));
    }

    @Test
    void whenPrinting_givenPattern_shouldShowSourceExpression() {
        assertEquals("Archive/*", GlobPattern.of("Archive/*").toString());
    }

}
