package ai.algovision.util;

public final class TextCanonicalizer {
    private TextCanonicalizer() {}

    /**
     * Strips a leading UTF-8 BOM (U+FEFF) from the provided String, if present. Returns the original string if no BOM
     * is present.
     */
    public static String stripUtf8Bom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }

    /** Number of UTF-8 bytes needed to encode {@code s[from, to)}. Unpaired surrogates count as the 3-byte U+FFFD. */
    public static int utf8Length(CharSequence s, int from, int to) {
        int bytes = 0;
        for (int i = from; i < to; i++) {
            char c = s.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < to && Character.isLowSurrogate(s.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }
}
