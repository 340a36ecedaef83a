package fun.fengwk.bmh.core.service.browser.runtime;

/**
 * A worker process could not be launched or never became reachable.
 *
 * @author fengwk
 */
public class WorkerSpawnException extends RuntimeException {

    public WorkerSpawnException(String message) {
        super(message);
    }

    public WorkerSpawnException(String message, Throwable cause) {
        super(message, cause);
    }

}
