package work.tierforge.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.tierforge.config.ProjectSettings;
import work.tierforge.config.ProjectSettingsLoader;
import work.tierforge.error.ScaffoldException;
import work.tierforge.error.ValidationException;
import work.tierforge.pipeline.ScaffoldRequest;
import work.tierforge.pipeline.ScaffoldStage;

/**
 * Public entry point for embedding the scaffolder. Failures are reported in the result, never thrown.
 */
public final class ScaffoldRunner {
    private static final Logger log = LoggerFactory.getLogger(ScaffoldRunner.class);

    public ScaffoldResult run(ScaffoldRunConfiguration configuration) {
        var started = Instant.now();
        var stage = new AtomicReference<>(ScaffoldStage.START);
        try {
            var workspace = ScaffoldWorkspace.open(settings(configuration));
            var request = request(configuration);
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("target", configuration.target());
            if (configuration.validateOnly()) {
                var schema = workspace.pipeline().validate(request);
                stage.set(ScaffoldStage.VALIDATED);
                metadata.put("stage", stage.get().name());
                metadata.put("schema", schema.toMap());
            } else {
                var output = workspace.pipeline().scaffold(request, next -> {
                    if (next != ScaffoldStage.FAILED) {
                        stage.set(next);
                    }
                });
                metadata.put("stage", stage.get().name());
                metadata.putAll(output.toMap());
            }
            return ScaffoldResult.success(metadata, started);
        } catch (ScaffoldException ex) {
            log.debug("Scaffold of {} failed at {}", configuration.target(), stage.get(), ex);
            var errorMeta = failureMetadata(configuration, stage.get(), ex.code(), ex.hints());
            if (ex instanceof ValidationException validation) {
                errorMeta.put("missing", validation.missingFields());
            }
            return ScaffoldResult.failure(ex.getMessage(), withDebugTrace(ex, errorMeta), started);
        } catch (RuntimeException ex) {
            log.warn("Scaffold of {} failed unexpectedly at {}", configuration.target(), stage.get(), ex);
            var errorMeta = failureMetadata(configuration, stage.get(), "ERR_INTERNAL", List.of());
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            return ScaffoldResult.failure(message, withDebugTrace(ex, errorMeta), started);
        }
    }

    private static LinkedHashMap<String, Object> failureMetadata(
        ScaffoldRunConfiguration configuration,
        ScaffoldStage failedAfter,
        String code,
        List<String> hints
    ) {
        var errorMeta = new LinkedHashMap<String, Object>();
        errorMeta.put("target", configuration.target());
        errorMeta.put("stage", ScaffoldStage.FAILED.name());
        errorMeta.put("failedAfter", failedAfter.name());
        errorMeta.put("code", code);
        errorMeta.put("hints", hints);
        return errorMeta;
    }

    private static LinkedHashMap<String, Object> withDebugTrace(RuntimeException ex, LinkedHashMap<String, Object> errorMeta) {
        if (Boolean.getBoolean("tierforge.debug")) {
            ex.printStackTrace();
        }
        return errorMeta;
    }

    private static ProjectSettings settings(ScaffoldRunConfiguration configuration) {
        var settings = configuration.settingsFile()
            .map(ProjectSettingsLoader::load)
            .orElseGet(() -> ProjectSettingsLoader.discover(configuration.workingDirectory()));
        if (configuration.templatesRoot().isPresent()) {
            settings = settings.withTemplatesRoot(configuration.templatesRoot().get().toAbsolutePath().normalize());
        }
        if (configuration.outputRoot().isPresent()) {
            settings = settings.withOutputRoot(configuration.outputRoot().get().toAbsolutePath().normalize());
        }
        return settings;
    }

    private static ScaffoldRequest request(ScaffoldRunConfiguration configuration) {
        return ScaffoldRequest.builder()
            .artifactType(configuration.artifactType())
            .templateName(configuration.templateName())
            .name(configuration.name())
            .values(configuration.values())
            .outputPath(configuration.outputPath())
            .write(configuration.write())
            .build();
    }
}
