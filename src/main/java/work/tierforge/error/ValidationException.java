package work.tierforge.error;

import java.util.List;

/**
 * Scaffold context missing required fields. Lists every missing name at once.
 */
public final class ValidationException extends ScaffoldException {
    private final List<String> missingFields;

    public ValidationException(String message, List<String> missingFields, List<String> hints) {
        super("ERR_VALIDATION", message, hints);
        this.missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public static ValidationException missing(String templateName, List<String> missing) {
        return new ValidationException(
            "Missing required fields for " + templateName + ": " + String.join(", ", missing),
            missing,
            List.of("Supply values for: " + String.join(", ", missing))
        );
    }

    public List<String> missingFields() {
        return missingFields;
    }
}
