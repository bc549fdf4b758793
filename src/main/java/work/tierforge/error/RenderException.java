package work.tierforge.error;

public final class RenderException extends ScaffoldException {
    public RenderException(String message, Throwable cause) {
        super("ERR_RENDER", message, java.util.List.of(), cause);
    }
}
