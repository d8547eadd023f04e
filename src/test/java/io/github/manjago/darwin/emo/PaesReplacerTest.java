package io.github.manjago.darwin.emo;

import io.github.manjago.darwin.config.EvolutionConfig;
import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.Pareto;
import io.github.manjago.darwin.engine.EvolutionContext;
import io.github.manjago.darwin.engine.StubEngineView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaesReplacerTest {

    private final EvolutionRandom random = new EvolutionRandom(8);
    private PaesReplacer<String> replacer;

    @BeforeEach
    void setUp() {
        AdaptiveGridArchiver<String> archiver = new AdaptiveGridArchiver<>();
        archiver.reset();
        replacer = new PaesReplacer<>(archiver);
    }

    private static Individual<String> ind(String name, double... values) {
        return new Individual<>(name, new Pareto(values), true);
    }

    private Individual<String> choose(Individual<String> parent, Individual<String> child,
                                      List<Individual<String>> archive) {
        EvolutionContext<String> ctx = new StubEngineView<String>()
                .withArchive(archive)
                .toContext(EvolutionConfig.builder().build());
        List<Individual<String>> survivors = replacer.replace(random, List.of(parent), List.of(parent),
                List.of(child), ctx);
        assertEquals(1, survivors.size());
        return survivors.get(0);
    }

    @Test
    @DisplayName("An offspring identical to its parent keeps the parent")
    void identical() {
        Individual<String> parent = ind("p", 1, 1);
        Individual<String> child = ind("p", 1, 1);

        assertSame(parent, choose(parent, child, List.of()));
    }

    @Test
    @DisplayName("An offspring fitness-equal to an archive member is taken")
    void equalToArchiveMember() {
        Individual<String> parent = ind("p", 5, 5);
        Individual<String> child = ind("c", 1, 1);

        assertSame(child, choose(parent, child, List.of(ind("m", 1, 1))));
    }

    @Test
    @DisplayName("Dominance between parent and offspring decides")
    void dominance() {
        Individual<String> weak = ind("w", 1, 1);
        Individual<String> strong = ind("s", 2, 2);

        assertSame(strong, choose(weak, strong, List.of()));
        assertSame(strong, choose(strong, weak, List.of()));
    }

    @Test
    @DisplayName("An offspring dominated by the archive loses")
    void dominatedByArchive() {
        Individual<String> parent = ind("p", 1, 9);
        Individual<String> child = ind("c", 9, 1);

        assertSame(parent, choose(parent, child, List.of(ind("m", 9.5, 1.5))));
    }

    @Test
    @DisplayName("An offspring dominating an archive member wins")
    void dominatesArchive() {
        Individual<String> parent = ind("p", 1, 9);
        Individual<String> child = ind("c", 9, 1);

        assertSame(child, choose(parent, child, List.of(ind("m", 8, 0.5))));
    }

    @Test
    @DisplayName("Otherwise the less crowded cell wins")
    void crowding() {
        List<Individual<String>> archive = List.of(ind("a", 1, 9), ind("b", 2, 8), ind("m", 1.5, 8.6));
        Individual<String> crowded = ind("x", 1.2, 8.8);
        Individual<String> lonely = ind("y", 9, 1);

        assertSame(lonely, choose(crowded, lonely, archive));
        assertSame(lonely, choose(lonely, crowded, archive));
    }

    @Test
    @DisplayName("The archive is left untouched")
    void archiveUntouched() {
        List<Individual<String>> archive = List.of(ind("a", 1, 9));
        StubEngineView<String> engine = new StubEngineView<String>().withArchive(archive);
        EvolutionContext<String> ctx = engine.toContext(EvolutionConfig.builder().build());

        replacer.replace(random, List.of(ind("p", 5, 5)), List.of(ind("p", 5, 5)), List.of(ind("c", 6, 6)), ctx);

        assertEquals(archive, engine.archive());
    }
}
