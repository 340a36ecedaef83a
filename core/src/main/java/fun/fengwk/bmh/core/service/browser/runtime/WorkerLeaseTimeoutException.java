package fun.fengwk.bmh.core.service.browser.runtime;

/**
 * No worker became available before the lease deadline.
 *
 * @author fengwk
 */
public class WorkerLeaseTimeoutException extends RuntimeException {

    public WorkerLeaseTimeoutException(String message) {
        super(message);
    }

}
