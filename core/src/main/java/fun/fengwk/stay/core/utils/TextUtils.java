package fun.fengwk.stay.core.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Small text helpers shared by extraction and normalization.
 *
 * @author fengwk
 */
public final class TextUtils {

    private TextUtils() {
    }

    /**
     * Capitalize the first letter of every space separated word and lower-case the rest.
     */
    public static String titleCase(String text) {
        if (StringUtils.isBlank(text)) {
            return "";
        }
        String[] words = StringUtils.normalizeSpace(text).split(" ");
        StringBuilder builder = new StringBuilder(text.length());
        for (String word : words) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            String lower = word.toLowerCase(Locale.ROOT);
            builder.append(Character.toUpperCase(lower.charAt(0))).append(lower, 1, lower.length());
        }
        return builder.toString();
    }

    /**
     * Cut the text to at most {@code maxLength} characters, trimming trailing whitespace.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength).trim();
    }

    public static boolean containsLetter(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

}
