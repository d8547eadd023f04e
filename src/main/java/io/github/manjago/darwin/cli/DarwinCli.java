package io.github.manjago.darwin.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Darwin CLI.
 *
 * Usage:
 *   darwin run [options]     - Optimize a demo problem
 *   darwin show <file>       - Show a stored run
 *   darwin info              - Show version and default config
 */
@Command(
    name = "darwin",
    description = "Population-based metaheuristic optimization",
    mixinStandardHelpOptions = true,
    version = "Darwin 1.0.0",
    subcommands = {
        RunCommand.class,
        ShowCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class DarwinCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DarwinCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
