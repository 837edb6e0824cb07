package ai.docsite.latex.inline;

import java.util.Locale;

/**
 * Label slugs: lowercase, every run of non-alphanumeric characters collapsed into one separator, separators trimmed
 * from both ends.
 */
public final class Slugs {

    static final String EMPTY_LABEL_FALLBACK = "section";

    private Slugs() {
    }

    public static String slugify(String text, String separator) {
        String lower = text.strip().toLowerCase(Locale.ROOT);
        StringBuilder builder = new StringBuilder(lower.length());
        boolean pendingSeparator = false;
        int index = 0;
        while (index < lower.length()) {
            int codePoint = lower.codePointAt(index);
            index += Character.charCount(codePoint);
            if (Character.isLetterOrDigit(codePoint)) {
                if (pendingSeparator && builder.length() > 0) {
                    builder.append(separator);
                }
                pendingSeparator = false;
                builder.appendCodePoint(codePoint);
            } else {
                pendingSeparator = true;
            }
        }
        return builder.toString();
    }

    /**
     * Slug used as a label; text without any alphanumeric character still yields a usable label.
     */
    public static String label(String text, String separator) {
        String slug = slugify(text, separator);
        return slug.isEmpty() ? EMPTY_LABEL_FALLBACK : slug;
    }
}
