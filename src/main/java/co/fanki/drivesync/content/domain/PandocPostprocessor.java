package co.fanki.drivesync.content.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans pandoc markdown so revisions diff line by line.
 *
 * <p>Applies, in order: removal of {@code :::} fenced div wrappers,
 * rewriting of {@code [text]{.underline}} spans to {@code <u>text</u>},
 * and conversion of simple tables to pipe tables.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PandocPostprocessor {

    private static final Pattern DIV_OPEN = Pattern.compile(
            "^:::\\s*\\{[^}]*\\}[ \\t]*(\\r?\\n|$)", Pattern.MULTILINE);

    private static final Pattern DIV_CLOSE = Pattern.compile(
            "^:::[ \\t]*(\\r?\\n|$)", Pattern.MULTILINE);

    private static final Pattern UNDERLINE = Pattern.compile(
            "\\[([^\\]]+)\\]\\{\\.underline\\}");

    private static final Pattern DASH_GROUP = Pattern.compile("-{2,}");

    private PandocPostprocessor() {
    }

    /**
     * Applies every cleanup step.
     *
     * @param markdown the pandoc output
     * @return the cleaned markdown
     */
    public static String postprocess(final String markdown) {
        String result = stripFencedDivs(markdown);
        result = cleanUnderlineSpans(result);
        return simpleTablesToPipe(result);
    }

    /**
     * Removes {@code :::} wrapper lines, keeping their content.
     *
     * @param text the markdown
     * @return the markdown without div fences
     */
    static String stripFencedDivs(final String text) {
        final String withoutOpen = DIV_OPEN.matcher(text).replaceAll("");
        return DIV_CLOSE.matcher(withoutOpen).replaceAll("");
    }

    /**
     * Rewrites underline spans as HTML.
     *
     * @param text the markdown
     * @return the markdown using {@code <u>} tags
     */
    static String cleanUnderlineSpans(final String text) {
        return UNDERLINE.matcher(text).replaceAll("<u>$1</u>");
    }

    /**
     * Converts simple tables, detected by their dash separator line, to
     * pipe tables. The line above the separator is the header and body
     * rows run until the first blank line.
     *
     * @param text the markdown
     * @return the markdown with pipe tables
     */
    static String simpleTablesToPipe(final String text) {
        final String[] lines = text.split("\n", -1);
        final List<String> result = new ArrayList<>();

        int i = 0;
        while (i < lines.length) {
            if (i > 0 && isSimpleTableSeparator(lines[i])) {
                final List<int[]> spans = columnSpans(lines[i]);
                final String header = lines[i - 1];
                if (!result.isEmpty()
                        && result.get(result.size() - 1).equals(header)) {
                    result.remove(result.size() - 1);
                }

                final List<String> headerCells = cells(header, spans);
                result.add(pipeRow(headerCells));
                final List<String> dashes = new ArrayList<>();
                for (final String cell : headerCells) {
                    dashes.add("-".repeat(cell.length()));
                }
                result.add(pipeRow(dashes));

                i++;
                while (i < lines.length && !lines[i].isBlank()) {
                    result.add(pipeRow(cells(lines[i], spans)));
                    i++;
                }
                continue;
            }
            result.add(lines[i]);
            i++;
        }
        return String.join("\n", result);
    }

    private static boolean isSimpleTableSeparator(final String line) {
        final String stripped = line.strip();
        if (stripped.isEmpty()) {
            return false;
        }
        final String[] parts = stripped.split("\\s+");
        if (parts.length < 2) {
            return false;
        }
        for (final String part : parts) {
            if (!part.matches("-{2,}")) {
                return false;
            }
        }
        return true;
    }

    private static List<int[]> columnSpans(final String separator) {
        final List<int[]> spans = new ArrayList<>();
        final Matcher matcher = DASH_GROUP.matcher(separator);
        while (matcher.find()) {
            spans.add(new int[] {matcher.start(), matcher.end()});
        }
        return spans;
    }

    private static List<String> cells(final String line,
            final List<int[]> spans) {
        final List<String> cells = new ArrayList<>();
        for (final int[] span : spans) {
            final int start = Math.min(span[0], line.length());
            final int end = Math.min(span[1], line.length());
            cells.add(line.substring(start, end).strip());
        }
        return cells;
    }

    private static String pipeRow(final List<String> cells) {
        return "| " + String.join(" | ", cells) + " |";
    }

}
