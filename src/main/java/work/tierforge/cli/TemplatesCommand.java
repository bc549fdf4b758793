package work.tierforge.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "templates",
    description = "List templates under the template root, or the registered artifact types.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class TemplatesCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    ProjectOptions project = new ProjectOptions();

    @CommandLine.Option(names = "--artifacts", description = "List artifact types instead of template files.")
    boolean artifacts;

    @Override
    public Integer call() {
        var workspace = project.openWorkspace();
        var out = spec.commandLine().getOut();
        if (artifacts) {
            var registry = workspace.artifacts()
                .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "No artifact registry configured"));
            for (var definition : registry.list()) {
                out.printf("%-16s %-9s %-9s %s%n",
                    definition.typeId(),
                    definition.kind().id(),
                    definition.outputType().id(),
                    definition.templatePath() != null ? definition.templatePath() : definition.fallbackTemplate());
            }
        } else {
            workspace.engine().listTemplates().forEach(out::println);
        }
        out.flush();
        return 0;
    }
}
