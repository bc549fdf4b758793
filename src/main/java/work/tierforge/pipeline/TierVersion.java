package work.tierforge.pipeline;

import java.util.Objects;

/**
 * One template of a resolved chain as recorded in the version registry.
 */
public record TierVersion(String tier, String templateId, String version) {
    public TierVersion {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(templateId, "templateId");
        Objects.requireNonNull(version, "version");
    }
}
