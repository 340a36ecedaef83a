package fun.fengwk.bmh.core.service.progress;

/**
 * Receives human readable progress of a running batch.
 *
 * @author fengwk
 */
public interface ProgressSink {

    /**
     * @param username account the event belongs to, empty for batch-level events
     */
    void emit(ProgressLevel level, String username, String message);

}
