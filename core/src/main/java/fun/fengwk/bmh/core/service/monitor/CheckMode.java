package fun.fengwk.bmh.core.service.monitor;

import java.util.Locale;

/**
 * @author fengwk
 */
public enum CheckMode {

    /**
     * Fast api first, web login when required by the cycle day policy or as fallback.
     */
    NORMAL("normal"),

    /**
     * Web login only.
     */
    WEB_ONLY("web_only");

    private final String value;

    CheckMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CheckMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CheckMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown check mode: " + value);
    }

}
