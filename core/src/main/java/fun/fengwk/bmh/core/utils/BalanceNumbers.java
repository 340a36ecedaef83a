package fun.fengwk.bmh.core.utils;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Balance text helpers.
 *
 * @author fengwk
 */
public final class BalanceNumbers {

    private static final Pattern FIRST_NUMBER_PATTERN = Pattern.compile("-?[\\d,]+(?:\\.\\d+)?");

    private BalanceNumbers() {
    }

    /**
     * Format a balance amount as display text, e.g. {@code 42.50 -> "$42.5"}.
     */
    public static String format(double amount) {
        return String.format(Locale.ROOT, "$%.1f", amount);
    }

    /**
     * Parse the first number found in text, thousands separators are ignored.
     *
     * @return parsed number or {@code null} when text contains no number
     */
    public static Double parseFirstNumber(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        Matcher matcher = FIRST_NUMBER_PATTERN.matcher(text);
        while (matcher.find()) {
            String normalized = matcher.group().replace(",", "");
            // Separators alone, keep scanning.
            if (normalized.isEmpty() || "-".equals(normalized)) {
                continue;
            }
            return Double.parseDouble(normalized);
        }
        return null;
    }

}
