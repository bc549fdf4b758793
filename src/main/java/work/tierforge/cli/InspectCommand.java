package work.tierforge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.tierforge.metadata.ScaffoldMetadataConfig;
import work.tierforge.metadata.ScaffoldMetadataParser;
import work.tierforge.pipeline.TemplateVersionRegistry;

@CommandLine.Command(
    name = "inspect",
    description = "Read the provenance header of a generated file.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class InspectCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    ProjectOptions project = new ProjectOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Generated file to inspect.")
    Path file;

    @Override
    public Integer call() throws Exception {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read file: " + file);
        }
        var settings = project.settings();
        var config = settings.metadataConfigPath()
            .map(ScaffoldMetadataConfig::shared)
            .orElseGet(ScaffoldMetadataConfig::shared);
        var parsed = new ScaffoldMetadataParser(config).parse(content, extension(file));
        if (parsed.isEmpty()) {
            spec.commandLine().getErr().println(file + " has no provenance header");
            spec.commandLine().getErr().flush();
            return 1;
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("file", file.toString());
        payload.put("metadata", parsed.get());
        String version = parsed.get().get("version");
        var versionRegistryPath = settings.versionRegistryPath();
        if (version != null && !version.isEmpty() && versionRegistryPath.isPresent() && Files.isRegularFile(versionRegistryPath.get())) {
            new TemplateVersionRegistry(versionRegistryPath.get()).lookupHash(version)
                .ifPresent(entry -> payload.put("tiers", entry.tiers()));
        }
        spec.commandLine().getOut().println(JSON_WRITER.writeValueAsString(payload));
        spec.commandLine().getOut().flush();
        return 0;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : "";
    }
}
