package work.tierforge.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "tierforge",
    description = "Scaffold files from tiered templates and stamp them with provenance headers.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ScaffoldCommand.class,
        SchemaCommand.class,
        TemplatesCommand.class,
        InspectCommand.class
    }
)
final class TierforgeCommand implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand");
    }
}
