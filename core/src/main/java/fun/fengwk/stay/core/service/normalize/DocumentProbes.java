package fun.fengwk.stay.core.service.normalize;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Optional-returning lookups over untrusted provider documents.
 *
 * @author fengwk
 */
final class DocumentProbes {

    private static final Pattern LEADING_COUNT = Pattern.compile("^\\s*(\\d+)");

    private static final BigInteger MAX_COUNT = BigInteger.valueOf(Integer.MAX_VALUE);

    private DocumentProbes() {
    }

    /**
     * Walk a dotted path through nested maps.
     */
    static Optional<Object> path(Map<String, Object> document, String dottedPath) {
        Object current = document;
        for (String key : StringUtils.split(dottedPath, '.')) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(key);
        }
        return Optional.ofNullable(current);
    }

    /**
     * First non-null value among the candidate paths.
     */
    static Optional<Object> first(Map<String, Object> document, List<String> paths) {
        for (String candidate : paths) {
            Optional<Object> value = path(document, candidate);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * First candidate that converts to non-blank text.
     */
    static Optional<String> firstText(Map<String, Object> document, List<String> paths) {
        for (String candidate : paths) {
            Optional<String> value = path(document, candidate).flatMap(DocumentProbes::text);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * First candidate that converts to a non-negative count.
     */
    static Optional<Integer> firstCount(Map<String, Object> document, List<String> paths) {
        for (String candidate : paths) {
            Optional<Integer> value = path(document, candidate).flatMap(DocumentProbes::count);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Strings and numbers become trimmed text, integral numbers without a fraction.
     */
    static Optional<String> text(Object value) {
        if (value instanceof String str) {
            return StringUtils.isBlank(str) ? Optional.empty() : Optional.of(StringUtils.normalizeSpace(str));
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            if (number instanceof Integer || number instanceof Long || number instanceof BigInteger) {
                return Optional.of(number.toString());
            }
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Optional.of(String.valueOf((long) d));
            }
            if (number instanceof BigDecimal decimal) {
                return Optional.of(decimal.toPlainString());
            }
            return Optional.of(String.valueOf(d));
        }
        return Optional.empty();
    }

    /**
     * Numbers and strings with a leading integer become a count, negatives are rejected and
     * values past {@link Integer#MAX_VALUE} saturate.
     */
    static Optional<Integer> count(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d < 0) {
                return Optional.empty();
            }
            return Optional.of((int) Math.min(d, Integer.MAX_VALUE));
        }
        if (value instanceof String str) {
            Matcher matcher = LEADING_COUNT.matcher(str);
            if (matcher.find()) {
                BigInteger parsed = new BigInteger(matcher.group(1));
                return Optional.of(parsed.min(MAX_COUNT).intValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Accepts absolute http(s) urls only.
     */
    static Optional<String> absoluteUrl(Object value) {
        if (!(value instanceof String str)) {
            return Optional.empty();
        }
        String trimmed = str.trim();
        if (StringUtils.startsWithIgnoreCase(trimmed, "https://") || StringUtils.startsWithIgnoreCase(trimmed, "http://")) {
            if (trimmed.length() > "https://".length() && !StringUtils.containsWhitespace(trimmed)) {
                return Optional.of(trimmed);
            }
        }
        return Optional.empty();
    }

}
