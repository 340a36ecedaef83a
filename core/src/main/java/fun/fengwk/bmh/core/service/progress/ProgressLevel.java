package fun.fengwk.bmh.core.service.progress;

/**
 * @author fengwk
 */
public enum ProgressLevel {

    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    SUCCESS("success");

    private final String value;

    ProgressLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

}
