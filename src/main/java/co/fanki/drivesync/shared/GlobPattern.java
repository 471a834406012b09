package co.fanki.drivesync.shared;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Shell-style wildcard pattern with fnmatch semantics.
 *
 * <p>{@code *} matches any run of characters including {@code /},
 * {@code ?} matches one character and {@code [...]} a character class
 * ({@code [!...]} negates it). Everything else matches literally.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GlobPattern implements ValueObject {

    private static final long serialVersionUID = 1L;

    private final String glob;

    private final Pattern regex;

    private GlobPattern(final String theGlob) {
        this.glob = Preconditions.requireNonNull(theGlob,
                "Glob cannot be null");
        this.regex = Pattern.compile(toRegex(theGlob), Pattern.DOTALL);
    }

    /**
     * Compiles a glob.
     *
     * @param glob the wildcard expression
     * @return the compiled pattern
     */
    public static GlobPattern of(final String glob) {
        return new GlobPattern(glob);
    }

    /**
     * Checks whether the whole value matches this pattern.
     *
     * @param value the value to test, never null
     * @return true on a full match
     */
    public boolean matches(final String value) {
        return regex.matcher(value).matches();
    }

    private static String toRegex(final String glob) {
        final StringBuilder out = new StringBuilder();
        int i = 0;
        final int n = glob.length();
        while (i < n) {
            final char c = glob.charAt(i++);
            if (c == '*') {
                out.append(".*");
            } else if (c == '?') {
                out.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    // unterminated class, literal bracket
                    out.append("\\[");
                } else {
                    String body = glob.substring(i, j).replace("\\", "\\\\");
                    i = j + 1;
                    if (body.startsWith("!")) {
                        body = "^" + body.substring(1);
                    } else if (body.startsWith("^")) {
                        body = "\\" + body;
                    }
                    out.append('[').append(body).append(']');
                }
            } else {
                out.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return out.toString();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GlobPattern)) {
            return false;
        }
        return glob.equals(((GlobPattern) o).glob);
    }

    @Override
    public int hashCode() {
        return Objects.hash(glob);
    }

    /** The source expression. */
    @Override
    public String toString() {
        return glob;
    }

}
