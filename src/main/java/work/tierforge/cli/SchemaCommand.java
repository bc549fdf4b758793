package work.tierforge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.LinkedHashMap;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.tierforge.introspect.TemplateSchema;
import work.tierforge.pipeline.ArtifactDefinition;

@CommandLine.Command(
    name = "schema",
    description = "Show which variables a template (or artifact type) requires.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class SchemaCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    ProjectOptions project = new ProjectOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "TEMPLATE", description = "Template name, or artifact type with --artifact.")
    String target;

    @CommandLine.Option(names = {"-a", "--artifact"}, description = "Treat TEMPLATE as an artifact type id.")
    boolean artifact;

    @Override
    public Integer call() throws Exception {
        var workspace = project.openWorkspace();
        String templateName = target;
        var payload = new LinkedHashMap<String, Object>();
        if (artifact) {
            ArtifactDefinition definition = workspace.artifacts()
                .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "No artifact registry configured"))
                .get(target);
            templateName = definition.templatePath() != null && workspace.engine().exists(definition.templatePath())
                ? definition.templatePath()
                : definition.fallbackTemplate();
            payload.put("artifact_type", definition.typeId());
            payload.put("artifact_required_fields", definition.requiredFields());
        }
        TemplateSchema schema = workspace.introspector().schema(templateName);
        payload.put("template", templateName);
        payload.putAll(schema.toMap());
        spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(payload));
        spec.commandLine().getOut().flush();
        return 0;
    }
}
