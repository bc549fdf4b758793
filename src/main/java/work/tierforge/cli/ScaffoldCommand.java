package work.tierforge.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.tierforge.api.ScaffoldResult;
import work.tierforge.api.ScaffoldRunConfiguration;
import work.tierforge.api.ScaffoldRunner;

@CommandLine.Command(
    name = "scaffold",
    description = "Render an artifact type (or a template) and write it with a provenance header.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class ScaffoldCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    ProjectOptions project = new ProjectOptions();

    @CommandLine.Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "ARTIFACT_TYPE",
        description = "Artifact type id from the artifact registry."
    )
    String artifactType;

    @CommandLine.Option(
        names = {"-t", "--template"},
        description = "Template name relative to the template root.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String templateName;

    @CommandLine.Option(names = {"-n", "--name"}, description = "Base name of the generated file.")
    String name;

    @CommandLine.Option(
        names = {"-s", "--set"},
        paramLabel = "KEY=VALUE",
        description = "Template variable; may be repeated."
    )
    Map<String, String> assignments = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|JSON|-",
        description = "JSON object of template variables: a file, an inline object, or '-' for stdin.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String input;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Output file (default: <output root>/<name><suffix><extension>).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @CommandLine.Option(names = "--print", description = "Print the rendered content instead of writing it.")
    boolean print;

    @CommandLine.Option(names = "--validate", description = "Only check that every required variable is supplied.")
    boolean validateOnly;

    @CommandLine.Option(names = "--json", description = "Print the run result as JSON.")
    boolean json;

    @Override
    public Integer call() throws Exception {
        if (artifactType == null && templateName == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Either ARTIFACT_TYPE or --template is required.");
        }
        var values = new LinkedHashMap<String, Object>(loadInput());
        values.putAll(assignments);

        var configuration = ScaffoldRunConfiguration.builder()
            .workingDirectory(project.projectDirectory)
            .settingsFile(project.settingsFile)
            .templatesRoot(project.templatesRoot)
            .artifactType(artifactType)
            .templateName(templateName)
            .name(name)
            .values(values)
            .outputPath(output)
            .write(!print)
            .validateOnly(validateOnly)
            .logLevel(project.logLevel())
            .build();

        ScaffoldResult result = new ScaffoldRunner().run(configuration);
        var out = spec.commandLine().getOut();
        if (json) {
            out.println(result.toPrettyJson());
        } else if (result.ok()) {
            printSuccess(result);
        } else {
            printFailure(result);
        }
        out.flush();
        return result.status().exitCode();
    }

    private void printSuccess(ScaffoldResult result) {
        var out = spec.commandLine().getOut();
        var metadata = result.metadata();
        if (validateOnly) {
            out.println("OK: " + configurationTarget() + " has every required variable");
        } else if (print) {
            out.print(metadata.get("content"));
        } else if (Boolean.TRUE.equals(metadata.get("written"))) {
            out.println("Wrote " + metadata.get("output_path") + " (version " + metadata.get("version") + ")");
        } else {
            // ephemeral artifacts are never written
            out.print(metadata.get("content"));
        }
    }

    private void printFailure(ScaffoldResult result) {
        var err = spec.commandLine().getErr();
        var metadata = result.metadata();
        err.println(spec.commandLine().getColorScheme().errorText(String.valueOf(metadata.get("error"))));
        if (metadata.get("hints") instanceof List<?> hints) {
            hints.forEach(hint -> err.println("  hint: " + hint));
        }
        err.flush();
    }

    private String configurationTarget() {
        return artifactType != null ? artifactType : templateName;
    }

    private Map<String, Object> loadInput() {
        if (input == null || input.isBlank()) {
            return Map.of();
        }
        String payload;
        String trimmed = input.trim();
        if ("-".equals(trimmed)) {
            try {
                payload = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
            }
        } else if (trimmed.startsWith("{")) {
            payload = trimmed;
        } else {
            Path path = Path.of(input).toAbsolutePath().normalize();
            try {
                payload = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + path);
            }
        }
        if (payload.isBlank()) {
            return Map.of();
        }
        try {
            var node = JSON.readTree(payload);
            if (node == null || !node.isObject()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "JSON input must be an object");
            }
            return JSON.convertValue(node, MAP_TYPE);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid JSON input: " + ex.getMessage());
        }
    }
}
