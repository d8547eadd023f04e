package io.github.manjago.darwin.cli;

import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.ScalarFitness;
import io.github.manjago.darwin.persistence.ResultStore;
import io.github.manjago.darwin.persistence.StoredRun;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Print a run stored by {@code darwin run --output}.
 *
 * Examples:
 *   darwin show result.mv
 *   darwin show result.mv --top 10
 */
@Command(
    name = "show",
    description = "Show a stored run",
    mixinStandardHelpOptions = true
)
public class ShowCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Result file")
    private Path file;

    @Option(names = {"-n", "--top"}, description = "Individuals to list (default: ${DEFAULT-VALUE})", defaultValue = "5")
    private int top;

    @Option(names = {"-a", "--archive"}, description = "List the archive instead of the population")
    private boolean archive;

    @Override
    public Integer call() throws IOException {
        if (!Files.exists(file)) {
            System.err.println("File not found: " + file);
            return 1;
        }
        if (!ResultStore.isValid(file)) {
            System.err.println(ResultStore.describe(file));
            return 1;
        }

        System.out.println(ResultStore.describe(file));
        StoredRun run = ResultStore.load(file);

        List<Individual<List<Double>>> individuals = new ArrayList<>(archive ? run.archive() : run.population());
        // Pareto fitness is only partially ordered; keep stored order for it
        if (individuals.stream().allMatch(ind -> ind.requireFitness() instanceof ScalarFitness)) {
            individuals.sort(Collections.reverseOrder());
        }

        System.out.println();
        System.out.printf("%s (%d, %s):%n", archive ? "Archive" : "Population", individuals.size(),
                run.maximize() ? "maximized" : "minimized");
        for (int i = 0; i < Math.min(top, individuals.size()); i++) {
            System.out.printf("  %2d. %s%n", i + 1, individuals.get(i));
        }
        return 0;
    }
}
