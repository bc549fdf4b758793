package work.tierforge.error;

import java.util.List;

/**
 * Base failure raised by the scaffolding engine. Carries a stable error code and
 * recovery hints that callers can show next to the message.
 */
public class ScaffoldException extends RuntimeException {
    private final String code;
    private final List<String> hints;

    public ScaffoldException(String code, String message) {
        this(code, message, List.of(), null);
    }

    public ScaffoldException(String code, String message, List<String> hints) {
        this(code, message, hints, null);
    }

    public ScaffoldException(String code, String message, List<String> hints, Throwable cause) {
        super(message, cause);
        this.code = code == null ? "ERR_INTERNAL" : code;
        this.hints = hints == null ? List.of() : List.copyOf(hints);
    }

    public String code() {
        return code;
    }

    public List<String> hints() {
        return hints;
    }
}
