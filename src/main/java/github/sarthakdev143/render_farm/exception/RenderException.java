package github.sarthakdev143.render_farm.exception;

public class RenderException extends Exception {

    private final int frame;

    public RenderException(int frame, String message) {
        super(message);
        this.frame = frame;
    }

    public RenderException(int frame, String message, Throwable cause) {
        super(message, cause);
        this.frame = frame;
    }

    public int getFrame() {
        return frame;
    }
}
