package portico.spi;

/**
 * Thrown by a {@link PreProcessor} to stop a request before it is forwarded.
 */
public class HookAbortedException extends RuntimeException {

    public static final int DEFAULT_STATUS = 403;

    private final int statusCode;

    public HookAbortedException(String reason) {
        this(DEFAULT_STATUS, reason);
    }

    public HookAbortedException(int statusCode, String reason) {
        super(reason);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    public String reason() {
        return getMessage();
    }
}
