package parsers;

import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts a raw setting value into its typed form.
 *
 * <p>Stages are tried in a fixed order and the first match wins:
 * quoted string, integer, float, boolean, comma separated list. Anything else is kept as the
 * trimmed string. Because numbers are tried before booleans, {@code 1} and {@code 0} come back as
 * integers.
 *
 * <p>Type mapping: quoted and plain strings -> String, integer -> Integer, Long or BigInteger
 * (smallest that fits), float -> Double, boolean -> Boolean, list -> unmodifiable List&lt;Object&gt;.
 */
public final class ValueCoercer {

    private static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "yes", Boolean.TRUE, "no", Boolean.FALSE,
            "true", Boolean.TRUE, "false", Boolean.FALSE,
            "1", Boolean.TRUE, "0", Boolean.FALSE
    );
    private static final Pattern FLOAT_PATTERN = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final String LIST_SEPARATOR = ",";

    private ValueCoercer() {
    }

    public static Object coerce(String raw) {
        Objects.requireNonNull(raw, "raw value must not be null");
        String value = raw.trim();

        Optional<String> quoted = unquote(value);
        if (quoted.isPresent()) {
            return quoted.get();
        }

        if (isNumber(value)) {
            Optional<Number> integer = toInteger(value);
            if (integer.isPresent()) {
                return integer.get();
            }
            Optional<Double> floating = toDouble(value);
            if (floating.isPresent()) {
                return floating.get();
            }
        }

        Optional<Boolean> bool = toBoolean(value);
        if (bool.isPresent()) {
            return bool.get();
        }

        Optional<List<Object>> list = toList(value);
        if (list.isPresent()) {
            return list.get();
        }

        return value;
    }

    /**
     * Digits with at most one decimal point, e.g. {@code 42}, {@code 4.2}, {@code .5} or {@code 5.}.
     */
    static boolean isNumber(String value) {
        if (StringUtils.countMatches(value, '.') > 1) {
            return false;
        }
        return StringUtils.isNumeric(StringUtils.remove(value, '.'));
    }

    public static Optional<Number> toInteger(String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }
        BigInteger parsed;
        try {
            parsed = new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(narrow(parsed));
    }

    public static Optional<Double> toDouble(String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (!FLOAT_PATTERN.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Case-insensitive lookup in the boolean vocabulary. Unlike {@link #coerce(String)}, this maps
     * {@code 1} and {@code 0} to booleans.
     */
    public static Optional<Boolean> toBoolean(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BOOLEAN_VALUES.get(value.trim().toLowerCase(Locale.ROOT)));
    }

    public static Optional<List<Object>> toList(String value) {
        if (value == null || !value.contains(LIST_SEPARATOR)) {
            return Optional.empty();
        }
        String[] parts = value.split(LIST_SEPARATOR, -1);
        List<Object> result = new ArrayList<>(parts.length);
        for (String part : parts) {
            result.add(coerce(part));
        }
        return Optional.of(Collections.unmodifiableList(result));
    }

    /**
     * Strips a matching pair of single or double quotes. The content between them is returned as is.
     */
    public static Optional<String> unquote(String value) {
        if (value == null || value.length() < 2) {
            return Optional.empty();
        }
        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);
        if ((first == '"' || first == '\'') && first == last) {
            return Optional.of(value.substring(1, value.length() - 1));
        }
        return Optional.empty();
    }

    private static Number narrow(BigInteger value) {
        if (value.bitLength() < Integer.SIZE) {
            return value.intValue();
        }
        if (value.bitLength() < Long.SIZE) {
            return value.longValue();
        }
        return value;
    }
}
