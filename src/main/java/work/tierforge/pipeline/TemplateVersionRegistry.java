package work.tierforge.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tierforge.error.ConfigException;
import work.tierforge.error.ScaffoldException;

/**
 * Persistent record of which tier chain produced each version hash, kept in a YAML file.
 */
public final class TemplateVersionRegistry {
    private static final Logger log = LoggerFactory.getLogger(TemplateVersionRegistry.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(
        new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
    );
    private static final List<String> ENTRY_KEYS = List.of("artifact_type", "created", "hash_algorithm");

    private final Path path;
    private final Clock clock;
    private final Map<String, Object> data;

    public TemplateVersionRegistry(Path path) {
        this(path, Clock.systemUTC());
    }

    public TemplateVersionRegistry(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        this.data = load(path);
    }

    public Path path() {
        return path;
    }

    /**
     * Records that {@code versionHash} was produced by {@code tiers}. Saving the same chain again is a
     * no-op.
     *
     * @throws ScaffoldException with code {@code ERR_VERSION_COLLISION} when the hash is already recorded
     *                           for another artifact type or another chain
     */
    public synchronized void saveVersion(String artifactType, String versionHash, List<TierVersion> tiers) {
        if (checkVersion(artifactType, versionHash, tiers)) {
            return;
        }
        var entry = new LinkedHashMap<String, Object>();
        entry.put("artifact_type", artifactType);
        entry.put("created", Instant.now(clock).toString());
        entry.put("hash_algorithm", VersionHasher.ALGORITHM);
        for (var tier : tiers) {
            var tierEntry = new LinkedHashMap<String, Object>();
            tierEntry.put("template_id", tier.templateId());
            tierEntry.put("version", tier.version());
            entry.put(tier.tier(), tierEntry);
        }
        section("version_hashes").put(versionHash, entry);
        section("current_versions").put(artifactType, versionHash);
        persist();
        log.info("Recorded template version {} for {}", versionHash, artifactType);
    }

    /**
     * Fails like {@link #saveVersion} would, without recording anything.
     *
     * @return whether this exact chain is already recorded under the hash
     */
    public synchronized boolean checkVersion(String artifactType, String versionHash, List<TierVersion> tiers) {
        var existing = lookupHash(versionHash);
        if (existing.isEmpty()) {
            return false;
        }
        var entry = existing.get();
        if (!entry.artifactType().equals(artifactType)) {
            throw collision("Hash collision: " + versionHash + " used by " + entry.artifactType() + " and " + artifactType);
        }
        if (entry.tiers().equals(tiers)) {
            return true;
        }
        throw collision("Hash collision: " + versionHash + " for " + artifactType + " maps to different tier versions");
    }

    public synchronized Optional<VersionEntry> lookupHash(String versionHash) {
        Object raw = section("version_hashes").get(versionHash);
        if (!(raw instanceof Map<?, ?> entry)) {
            return Optional.empty();
        }
        var tiers = new ArrayList<TierVersion>();
        entry.forEach((key, value) -> {
            if (!ENTRY_KEYS.contains(String.valueOf(key)) && value instanceof Map<?, ?> tier) {
                tiers.add(new TierVersion(
                    String.valueOf(key),
                    String.valueOf(tier.get("template_id")),
                    String.valueOf(tier.get("version"))
                ));
            }
        });
        return Optional.of(new VersionEntry(
            String.valueOf(entry.get("artifact_type")),
            String.valueOf(entry.get("created")),
            String.valueOf(entry.get("hash_algorithm")),
            tiers
        ));
    }

    public synchronized Optional<String> currentVersion(String artifactType) {
        Object value = section("current_versions").get(artifactType);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public synchronized List<String> allHashes() {
        return List.copyOf(section("version_hashes").keySet());
    }

    public synchronized List<String> artifactTypes() {
        return List.copyOf(section("current_versions").keySet());
    }

    private static Map<String, Object> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return emptyRegistry();
        }
        try {
            Map<String, Object> loaded = YAML_MAPPER.readValue(path.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
            if (loaded == null) {
                return emptyRegistry();
            }
            var data = emptyRegistry();
            data.putAll(loaded);
            return data;
        } catch (IOException ex) {
            throw new ConfigException("Template version registry could not be read: " + ex.getMessage(), path, List.of(), ex);
        }
    }

    private static Map<String, Object> emptyRegistry() {
        var data = new LinkedHashMap<String, Object>();
        data.put("version", "1.0");
        data.put("version_hashes", new LinkedHashMap<String, Object>());
        data.put("current_versions", new LinkedHashMap<String, Object>());
        data.put("templates", new LinkedHashMap<String, Object>());
        return data;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> section(String name) {
        Object value = data.get(name);
        if (!(value instanceof Map<?, ?>)) {
            value = new LinkedHashMap<String, Object>();
            data.put(name, value);
        }
        return (Map<String, Object>) value;
    }

    private void persist() {
        data.put("last_updated", Instant.now(clock).toString());
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            YAML_MAPPER.writeValue(path.toFile(), data);
        } catch (IOException ex) {
            throw new ScaffoldException("ERR_IO", "Failed to write template version registry " + path + ": " + ex.getMessage(), List.of(), ex);
        }
    }

    private static ScaffoldException collision(String message) {
        return new ScaffoldException(
            "ERR_VERSION_COLLISION",
            message,
            List.of("Bump the version of the template that changed so the chain hashes differently")
        );
    }

    /**
     * Registry entry for one version hash.
     */
    public record VersionEntry(String artifactType, String created, String hashAlgorithm, List<TierVersion> tiers) {
        public VersionEntry {
            tiers = List.copyOf(tiers);
        }
    }
}
