package fun.fengwk.bmh.core.service.state;

/**
 * Thrown when a state file cannot be read or written.
 *
 * @author fengwk
 */
public class StatePersistenceException extends RuntimeException {

    public StatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

}
