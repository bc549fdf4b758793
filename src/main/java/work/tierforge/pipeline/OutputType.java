package work.tierforge.pipeline;

import java.util.Optional;

/**
 * Whether scaffolded output is written to disk or only returned (commit messages and the like).
 */
public enum OutputType {
    FILE("file"),
    EPHEMERAL("ephemeral");

    private final String id;

    OutputType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<OutputType> fromId(String id) {
        for (var type : values()) {
            if (type.id.equals(id)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
