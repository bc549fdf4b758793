package work.tierforge.pipeline;

import java.util.Optional;

/**
 * Broad family an artifact type belongs to.
 */
public enum ArtifactKind {
    CODE("code"),
    DOC("doc"),
    CONFIG("config"),
    TRACKING("tracking");

    private final String id;

    ArtifactKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ArtifactKind> fromId(String id) {
        for (var kind : values()) {
            if (kind.id.equals(id)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
