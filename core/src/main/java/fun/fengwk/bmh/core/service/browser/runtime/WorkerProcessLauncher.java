package fun.fengwk.bmh.core.service.browser.runtime;

import java.io.IOException;

/**
 * Starts the external process behind a worker.
 *
 * @author fengwk
 */
public interface WorkerProcessLauncher {

    /**
     * Launch a process that serves its control protocol on the given local port.
     */
    Process launch(String workerId, int port) throws IOException;

    /**
     * Called after the worker process has been terminated.
     */
    default void afterTermination(String workerId) {
    }

}
