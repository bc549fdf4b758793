package work.tierforge.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tierforge.error.ConfigException;
import work.tierforge.error.ScaffoldException;
import work.tierforge.error.ValidationException;
import work.tierforge.introspect.ResolvedChain;
import work.tierforge.introspect.SystemFields;
import work.tierforge.introspect.TemplateHeader;
import work.tierforge.introspect.TemplateIntrospector;
import work.tierforge.introspect.TemplateSchema;
import work.tierforge.introspect.VariableClassifier;
import work.tierforge.metadata.ProvenanceHeader;
import work.tierforge.metadata.ScaffoldMetadataConfig;
import work.tierforge.template.TemplateEngine;

/**
 * Introspects, validates, renders and stamps one artifact per call.
 *
 * <p>A run moves through {@link ScaffoldStage}s in order; any failure ends it in
 * {@link ScaffoldStage#FAILED} and the exception reaches the caller. Nothing is written unless every
 * earlier stage succeeded.
 */
public final class ScaffoldPipeline {
    private static final Logger log = LoggerFactory.getLogger(ScaffoldPipeline.class);
    private static final List<String> TEMPLATE_SUFFIXES = List.of(".jinja2", ".j2");

    private final TemplateEngine engine;
    private final TemplateIntrospector introspector;
    private final VariableClassifier classifier;
    private final ScaffoldMetadataConfig metadataConfig;
    private final ArtifactRegistry artifacts;
    private final TemplateVersionRegistry versions;
    private final Path outputRoot;
    private final Clock clock;

    private ScaffoldPipeline(Builder builder) {
        this.engine = Objects.requireNonNull(builder.engine, "engine");
        this.introspector = builder.introspector != null ? builder.introspector : new TemplateIntrospector(engine);
        this.classifier = new VariableClassifier();
        this.metadataConfig = builder.metadataConfig != null ? builder.metadataConfig : ScaffoldMetadataConfig.shared();
        this.artifacts = builder.artifacts;
        this.versions = builder.versions;
        this.outputRoot = builder.outputRoot != null ? builder.outputRoot : Path.of(".");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder(TemplateEngine engine) {
        return new Builder(engine);
    }

    public ScaffoldOutput scaffold(ScaffoldRequest request) {
        return scaffold(request, stage -> {});
    }

    public ScaffoldOutput scaffold(ScaffoldRequest request, Consumer<ScaffoldStage> listener) {
        listener.accept(ScaffoldStage.START);
        try {
            var plan = prepare(request, listener);
            String body = engine.render(plan.templateName, plan.context);
            listener.accept(ScaffoldStage.RENDERED);

            String content = header(plan) + body;
            boolean recordVersion = versions != null && plan.outputType == OutputType.FILE;
            if (recordVersion) {
                versions.checkVersion(plan.artifactId, plan.versionHash, plan.tiers);
            }
            boolean written = false;
            if (plan.outputType == OutputType.FILE && request.write()) {
                writeRecorded(plan, content, recordVersion);
                written = true;
                listener.accept(ScaffoldStage.WRITTEN);
            } else if (recordVersion) {
                versions.saveVersion(plan.artifactId, plan.versionHash, plan.tiers);
            }
            log.info("Scaffolded {} from {}{}", plan.fileName, plan.templateName, written ? " -> " + plan.outputPath : "");
            return new ScaffoldOutput(
                plan.artifactId,
                plan.templateName,
                content,
                plan.fileName,
                plan.outputType == OutputType.FILE ? plan.outputPath : null,
                plan.versionHash,
                plan.schema,
                written
            );
        } catch (RuntimeException ex) {
            listener.accept(ScaffoldStage.FAILED);
            throw ex;
        }
    }

    /**
     * Runs the pipeline up to {@link ScaffoldStage#VALIDATED} without rendering.
     *
     * @return the schema the request was checked against
     * @throws ValidationException listing every missing required field
     */
    public TemplateSchema validate(ScaffoldRequest request) {
        return prepare(request, stage -> {}).schema;
    }

    private Plan prepare(ScaffoldRequest request, Consumer<ScaffoldStage> listener) {
        var plan = new Plan();
        ArtifactDefinition artifact = null;
        if (request.artifactType() != null) {
            if (artifacts == null) {
                throw new ConfigException(
                    "No artifact registry configured",
                    null,
                    List.of("Set artifacts.registry in tierforge.toml or pass a template name instead")
                );
            }
            artifact = artifacts.get(request.artifactType());
        }
        plan.templateName = request.templateName() != null ? request.templateName() : templateFor(artifact);

        ResolvedChain chain = introspector.resolve(plan.templateName);
        plan.schema = classifier.classify(chain);
        plan.tiers = tierVersions(chain);
        plan.artifactId = artifact != null ? artifact.typeId() : templateId(plan.templateName);
        plan.versionHash = VersionHasher.hash(plan.artifactId, plan.templateName, plan.tiers);
        listener.accept(ScaffoldStage.INTROSPECTED);

        plan.outputType = artifact != null ? artifact.outputType() : OutputType.FILE;
        plan.extension = artifact != null ? artifact.fileExtension() : outputExtension(plan.templateName);
        String baseName = request.name() != null ? request.name() : String.valueOf(request.values().getOrDefault("name", "unnamed"));
        if (request.outputPath() != null) {
            plan.outputPath = request.outputPath().isAbsolute() ? request.outputPath() : outputRoot.resolve(request.outputPath());
            plan.fileName = request.outputPath().getFileName().toString();
        } else {
            plan.fileName = artifact != null ? artifact.fileName(baseName) : baseName + plan.extension;
            plan.outputPath = outputRoot.resolve(plan.fileName);
        }
        plan.created = Instant.now(clock);
        plan.context = buildContext(request, plan);
        listener.accept(ScaffoldStage.CONTEXT_BUILT);

        var required = new TreeSet<>(plan.schema.required());
        if (artifact != null) {
            required.addAll(artifact.requiredFields());
        }
        var missing = new ArrayList<String>();
        for (String name : required) {
            if (plan.context.get(name) == null) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw ValidationException.missing(plan.templateName, missing);
        }
        listener.accept(ScaffoldStage.VALIDATED);
        return plan;
    }

    private Map<String, Object> buildContext(ScaffoldRequest request, Plan plan) {
        var context = new LinkedHashMap<String, Object>(request.values());
        if (request.name() != null) {
            context.putIfAbsent("name", request.name());
        }
        context.put(SystemFields.TEMPLATE_ID, plan.artifactId);
        context.put(SystemFields.TEMPLATE_VERSION, plan.versionHash);
        context.put(SystemFields.SCAFFOLD_CREATED, ProvenanceHeader.timestamp(plan.created));
        context.put(SystemFields.OUTPUT_PATH, plan.outputType == OutputType.FILE ? displayPath(plan.outputPath) : "");
        context.put(SystemFields.FORMAT, plan.extension.startsWith(".") ? plan.extension.substring(1) : plan.extension);
        return context;
    }

    private String header(Plan plan) {
        var header = new ProvenanceHeader(
            plan.artifactId,
            plan.versionHash,
            plan.created,
            null,
            plan.outputType == OutputType.FILE ? displayPath(plan.outputPath) : null
        );
        if (plan.outputType == OutputType.EPHEMERAL) {
            return header.renderCompact();
        }
        var syntax = metadataConfig.syntaxForExtension(plan.extension);
        if (syntax.isEmpty()) {
            log.warn("No comment syntax for {} files, {} gets no provenance header", plan.extension, plan.fileName);
            return "";
        }
        return header.render(syntax.get());
    }

    private String templateFor(ArtifactDefinition artifact) {
        if (artifact.templatePath() != null && engine.exists(artifact.templatePath())) {
            return artifact.templatePath();
        }
        if (artifact.fallbackTemplate() != null) {
            log.debug("Template {} missing for {}, using fallback {}", artifact.templatePath(), artifact.typeId(), artifact.fallbackTemplate());
            return artifact.fallbackTemplate();
        }
        return artifact.templatePath();
    }

    /**
     * Tier names come from each template's header; without one the root is tier0, the next tier1 and so
     * on, and the queried template is "concrete".
     */
    private List<TierVersion> tierVersions(ResolvedChain chain) {
        var tiers = new ArrayList<TierVersion>();
        var names = chain.chain();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            TemplateHeader header = introspector.header(name).orElse(null);
            String tier = header != null && header.tier() != null
                ? tierName(header.tier())
                : (i == names.size() - 1 ? "concrete" : "tier" + i);
            String id = header != null && header.id() != null ? header.id() : templateId(name);
            String version = header != null && header.version() != null ? header.version() : "0";
            tiers.add(new TierVersion(tier, id, version));
        }
        return tiers;
    }

    private static String tierName(String declared) {
        String trimmed = declared.strip();
        return trimmed.chars().allMatch(Character::isDigit) ? "tier" + trimmed : trimmed;
    }

    private String displayPath(Path path) {
        Path absoluteRoot = outputRoot.toAbsolutePath().normalize();
        Path absolute = path.toAbsolutePath().normalize();
        Path shown = absolute.startsWith(absoluteRoot) ? absoluteRoot.relativize(absolute) : absolute;
        return shown.toString().replace('\\', '/');
    }

    /**
     * Stages the content next to its target and only moves it into place once the version is recorded.
     */
    private void writeRecorded(Plan plan, String content, boolean recordVersion) {
        Path target = plan.outputPath.toAbsolutePath().normalize();
        Path staged = null;
        try {
            Files.createDirectories(target.getParent());
            staged = Files.createTempFile(target.getParent(), "." + plan.fileName, ".tmp");
            Files.writeString(staged, content, StandardCharsets.UTF_8);
            if (recordVersion) {
                versions.saveVersion(plan.artifactId, plan.versionHash, plan.tiers);
            }
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            var failure = new ScaffoldException("ERR_IO", "Failed to write " + target + ": " + ex.getMessage(), List.of(), ex);
            discard(staged, failure);
            throw failure;
        } catch (RuntimeException ex) {
            discard(staged, ex);
            throw ex;
        }
    }

    private static void discard(Path staged, RuntimeException failure) {
        if (staged == null) {
            return;
        }
        try {
            Files.deleteIfExists(staged);
        } catch (IOException ex) {
            log.warn("Could not remove staged file {}", staged);
            failure.addSuppressed(ex);
        }
    }

    /**
     * {@code concrete/dto.py.jinja2} becomes {@code dto}.
     */
    static String templateId(String templateName) {
        String file = templateName.substring(templateName.lastIndexOf('/') + 1);
        file = stripTemplateSuffix(file);
        int dot = file.indexOf('.');
        String id = dot > 0 ? file.substring(0, dot) : file;
        return id.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
    }

    /**
     * {@code concrete/dto.py.jinja2} renders {@code .py} output; a template without an inner extension
     * renders {@code .txt}.
     */
    static String outputExtension(String templateName) {
        String file = stripTemplateSuffix(templateName.substring(templateName.lastIndexOf('/') + 1));
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(dot) : ".txt";
    }

    private static String stripTemplateSuffix(String file) {
        for (String suffix : TEMPLATE_SUFFIXES) {
            if (file.endsWith(suffix)) {
                return file.substring(0, file.length() - suffix.length());
            }
        }
        return file;
    }

    private static final class Plan {
        String templateName;
        String artifactId;
        TemplateSchema schema;
        List<TierVersion> tiers;
        String versionHash;
        OutputType outputType;
        String extension;
        String fileName;
        Path outputPath;
        Instant created;
        Map<String, Object> context;
    }

    public static final class Builder {
        private final TemplateEngine engine;
        private TemplateIntrospector introspector;
        private ScaffoldMetadataConfig metadataConfig;
        private ArtifactRegistry artifacts;
        private TemplateVersionRegistry versions;
        private Path outputRoot;
        private Clock clock;

        private Builder(TemplateEngine engine) {
            this.engine = engine;
        }

        public Builder introspector(TemplateIntrospector introspector) {
            this.introspector = introspector;
            return this;
        }

        public Builder metadataConfig(ScaffoldMetadataConfig metadataConfig) {
            this.metadataConfig = metadataConfig;
            return this;
        }

        public Builder artifacts(ArtifactRegistry artifacts) {
            this.artifacts = artifacts;
            return this;
        }

        public Builder versions(TemplateVersionRegistry versions) {
            this.versions = versions;
            return this;
        }

        public Builder outputRoot(Path outputRoot) {
            this.outputRoot = outputRoot;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ScaffoldPipeline build() {
            return new ScaffoldPipeline(this);
        }
    }
}
