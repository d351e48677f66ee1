package fun.fengwk.stay.core.service.intent;

import fun.fengwk.stay.core.utils.TextUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Cleans raw query text before interpretation.
 *
 * @author fengwk
 */
@Component
public class QuerySanitizer {

    public static final int MAX_QUERY_LENGTH = 1000;

    private static final Pattern SCRIPT_BLOCK_PATTERN =
        Pattern.compile("<(script|style)[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>");
    private static final Pattern UNSAFE_CHAR_PATTERN = Pattern.compile("[^\\p{L}\\p{N}\\s.,!?'\"$+&/:-]");

    /**
     * Strip tags and characters outside the allow-list, collapse whitespace and cap the length.
     *
     * @throws IllegalArgumentException when nothing searchable is left
     */
    public String sanitize(String rawQuery) {
        if (rawQuery == null) {
            throw new IllegalArgumentException("query is required");
        }
        String text = SCRIPT_BLOCK_PATTERN.matcher(rawQuery).replaceAll(" ");
        text = TAG_PATTERN.matcher(text).replaceAll(" ");
        text = UNSAFE_CHAR_PATTERN.matcher(text).replaceAll("");
        text = StringUtils.normalizeSpace(text);
        text = TextUtils.truncate(text, MAX_QUERY_LENGTH);
        if (StringUtils.isBlank(text) || !StringUtils.containsAny(text, "0123456789") && !TextUtils.containsLetter(text)) {
            throw new IllegalArgumentException("query is blank");
        }
        return text;
    }

}
