package co.fanki.drivesync.content.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for {@link PandocPostprocessor}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PandocPostprocessorTest {

    @Test
    void whenStrippingDivs_givenCommentWrapper_shouldKeepContent() {
        final String result = PandocPostprocessor.stripFencedDivs(
                "::: {.comment}\ntext\n:::\nmore");

        assertEquals("text\nmore", result);
    }

    @Test
    void whenCleaningUnderline_givenSpan_shouldUseHtmlTag() {
        assertEquals("a <u>b c</u> d",
                PandocPostprocessor.cleanUnderlineSpans("a [b c]{.underline} d"));
    }

    @Test
    void whenConvertingTables_givenSimpleTable_shouldEmitPipeTable() {
        final String markdown = """
                  Name   Age
                  ------ -----
                  Ana    30

                after""";

        final String result = PandocPostprocessor.simpleTablesToPipe(markdown);

        assertEquals("""
                | Name | Age |
                | ---- | --- |
                | Ana | 30 |

                after""", result);
    }

    @Test
    void whenConvertingTables_givenHorizontalRule_shouldLeaveItAlone() {
        final String markdown = "intro\n-----\nrest";

        assertEquals(markdown, PandocPostprocessor.simpleTablesToPipe(markdown));
    }

    @Test
    void whenPostprocessing_givenAllConstructs_shouldApplyEveryStep() {
        final String result = PandocPostprocessor.postprocess(
                "::: {.insertion}\n[new]{.underline} clause\n:::\n");

        assertEquals("<u>new</u> clause\n", result);
    }

}
