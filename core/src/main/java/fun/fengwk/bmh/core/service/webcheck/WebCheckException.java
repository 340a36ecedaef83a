package fun.fengwk.bmh.core.service.webcheck;

/**
 * The web check could not run at all, e.g. no browser worker or the hook command failed.
 *
 * @author fengwk
 */
public class WebCheckException extends Exception {

    public WebCheckException(String message) {
        super(message);
    }

    public WebCheckException(String message, Throwable cause) {
        super(message, cause);
    }

}
