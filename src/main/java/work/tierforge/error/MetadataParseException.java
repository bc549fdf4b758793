package work.tierforge.error;

/**
 * Provenance header that is present but malformed. Absent headers are not an error.
 */
public final class MetadataParseException extends ScaffoldException {
    private final String field;

    public MetadataParseException(String message) {
        this(message, null);
    }

    public MetadataParseException(String message, String field) {
        super("ERR_METADATA", message);
        this.field = field;
    }

    /**
     * Name of the offending field, or {@code null} when the whole line is at fault.
     */
    public String field() {
        return field;
    }
}
