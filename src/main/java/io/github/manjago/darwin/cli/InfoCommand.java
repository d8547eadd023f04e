package io.github.manjago.darwin.cli;

import io.github.manjago.darwin.config.EvolutionConfig;
import picocli.CommandLine.Command;

import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * Show information about Darwin.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("DARWIN 1.0.0 - evolutionary computation engine");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(EvolutionConfig.defaults());

        System.out.println("Algorithms: " + Arrays.toString(RunCommand.Algorithm.values()));
        System.out.println("Problems:   " + Arrays.toString(DemoProblem.values()));
        System.out.println();

        return 0;
    }
}
