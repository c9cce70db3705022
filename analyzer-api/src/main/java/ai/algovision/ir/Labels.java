package ai.algovision.ir;

import java.util.regex.Pattern;

/** Normalization of CFG node labels taken from source spans. */
public final class Labels {
    public static final int MAX_LABEL_LENGTH = 60;
    public static final String ELLIPSIS = "…";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Labels() {}

    /** Trims, collapses every whitespace run (newlines included) to one space, and truncates with an ellipsis. */
    public static String normalize(String raw) {
        var collapsed = WHITESPACE.matcher(raw.strip()).replaceAll(" ");
        if (collapsed.length() <= MAX_LABEL_LENGTH) {
            return collapsed;
        }
        return collapsed.substring(0, MAX_LABEL_LENGTH - 1).stripTrailing() + ELLIPSIS;
    }
}
