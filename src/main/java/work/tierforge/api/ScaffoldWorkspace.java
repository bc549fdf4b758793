package work.tierforge.api;

import java.util.Optional;
import work.tierforge.config.ProjectSettings;
import work.tierforge.introspect.TemplateIntrospector;
import work.tierforge.metadata.ScaffoldMetadataConfig;
import work.tierforge.pipeline.ArtifactRegistry;
import work.tierforge.pipeline.ScaffoldPipeline;
import work.tierforge.pipeline.TemplateVersionRegistry;
import work.tierforge.template.TemplateEngine;

/**
 * Engine, introspector, registries and pipeline wired for one project.
 */
public final class ScaffoldWorkspace {
    private final TemplateEngine engine;
    private final TemplateIntrospector introspector;
    private final ArtifactRegistry artifacts;
    private final ScaffoldPipeline pipeline;

    private ScaffoldWorkspace(ProjectSettings settings) {
        this.engine = new TemplateEngine(settings.templatesRoot());
        this.introspector = new TemplateIntrospector(engine);
        var metadataConfig = settings.metadataConfigPath()
            .map(ScaffoldMetadataConfig::shared)
            .orElseGet(ScaffoldMetadataConfig::shared);
        this.artifacts = settings.artifactRegistryPath().map(ArtifactRegistry::load).orElse(null);
        var versions = settings.versionRegistryPath().map(TemplateVersionRegistry::new).orElse(null);
        this.pipeline = ScaffoldPipeline.builder(engine)
            .introspector(introspector)
            .metadataConfig(metadataConfig)
            .artifacts(artifacts)
            .versions(versions)
            .outputRoot(settings.outputRoot())
            .build();
    }

    /**
     * @throws work.tierforge.error.ConfigException when the template root or a configured file is missing
     */
    public static ScaffoldWorkspace open(ProjectSettings settings) {
        return new ScaffoldWorkspace(settings);
    }

    public TemplateEngine engine() {
        return engine;
    }

    public TemplateIntrospector introspector() {
        return introspector;
    }

    public Optional<ArtifactRegistry> artifacts() {
        return Optional.ofNullable(artifacts);
    }

    public ScaffoldPipeline pipeline() {
        return pipeline;
    }
}
