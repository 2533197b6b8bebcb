package it.cavallium.sqlkeeper.core.common.cdc;

import java.util.Map;
import java.util.function.IntPredicate;
import org.jetbrains.annotations.Nullable;

/**
 * Row filter in the {@code column=operator.value} form, for example {@code author_id=eq.123}.
 * Supported operators: eq, neq, gt, gte, lt, lte, like. Unknown operators match every row.
 */
public record CdcFilter(String column, String operator, String value) {

    /**
     * @return the parsed filter, or null if the text is not in the {@code column=operator.value} form
     */
    public static @Nullable CdcFilter parse(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        int eqIdx = text.indexOf('=');
        if (eqIdx == -1) {
            return null;
        }
        var rest = text.substring(eqIdx + 1);
        int dotIdx = rest.indexOf('.');
        if (dotIdx == -1) {
            return null;
        }
        return new CdcFilter(text.substring(0, eqIdx), rest.substring(0, dotIdx), rest.substring(dotIdx + 1));
    }

    public boolean matches(Map<String, Object> row) {
        var raw = row.get(column);
        var actual = raw != null ? String.valueOf(raw) : "";
        return switch (operator) {
            case "eq" -> actual.equals(value);
            case "neq" -> !actual.equals(value);
            case "gt" -> compareNumbers(actual, value, cmp -> cmp > 0);
            case "gte" -> compareNumbers(actual, value, cmp -> cmp >= 0);
            case "lt" -> compareNumbers(actual, value, cmp -> cmp < 0);
            case "lte" -> compareNumbers(actual, value, cmp -> cmp <= 0);
            case "like" -> actual.contains(value);
            default -> true;
        };
    }

    /**
     * A non-numeric side never matches.
     */
    private static boolean compareNumbers(String left, String right, IntPredicate test) {
        double a = toNumber(left);
        double b = toNumber(right);
        if (Double.isNaN(a) || Double.isNaN(b)) {
            return false;
        }
        return test.test(Double.compare(a, b));
    }

    private static double toNumber(String text) {
        var trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    @Override
    public String toString() {
        return column + "=" + operator + "." + value;
    }
}
