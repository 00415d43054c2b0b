package github.sarthakdev143.render_farm.exception;

/**
 * The scene could not be placed in shared storage or made self-contained. No frame of the
 * job can render without it, so the whole job is aborted.
 */
public class PreparationException extends Exception {

    public PreparationException(String message) {
        super(message);
    }

    public PreparationException(String message, Throwable cause) {
        super(message, cause);
    }
}
