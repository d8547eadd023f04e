package io.github.manjago.darwin.persistence;

import io.github.manjago.darwin.core.EvolutionRandom;
import io.github.manjago.darwin.core.Fitness;
import io.github.manjago.darwin.core.Individual;
import io.github.manjago.darwin.core.Pareto;
import io.github.manjago.darwin.core.ScalarFitness;
import io.github.manjago.darwin.engine.EvolutionEngine;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Result storage using H2 MVStore.
 *
 * Structure:
 * - "meta" map: version, counters, seed, sizes, polarity
 * - "info" map: termination cause
 * - "rng" map: RNG state bytes
 * - "population" / "archive" maps: binary-encoded individuals by position
 *
 * Candidates are real vectors; fitness is scalar or Pareto.
 */
public class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    private static final int VERSION = 1;

    // Meta keys
    private static final String KEY_VERSION = "version";
    private static final String KEY_GENERATIONS = "generations";
    private static final String KEY_EVALUATIONS = "evaluations";
    private static final String KEY_SEED = "seed";
    private static final String KEY_POPULATION_SIZE = "population_size";
    private static final String KEY_ARCHIVE_SIZE = "archive_size";
    private static final String KEY_MAXIMIZE = "maximize";

    // Info keys
    private static final String KEY_TERMINATION = "termination_cause";

    // Fitness kinds
    private static final byte SCALAR = 0;
    private static final byte PARETO = 1;

    private ResultStore() {
    }

    /**
     * Save the finished run of {@code engine}.
     */
    public static void save(EvolutionEngine<List<Double>> engine, Path path) throws IOException {
        save(StoredRun.of(engine), path);
    }

    /**
     * Save a run to an MVStore file, replacing any previous content.
     */
    public static void save(StoredRun run, Path path) throws IOException {
        log.info("Saving run to {} (MVStore)", path);

        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .compress()
                .open()) {

            MVMap<String, Long> meta = store.openMap("meta");
            meta.put(KEY_VERSION, (long) VERSION);
            meta.put(KEY_GENERATIONS, run.generations());
            meta.put(KEY_EVALUATIONS, run.evaluations());
            meta.put(KEY_SEED, run.seed());
            meta.put(KEY_POPULATION_SIZE, (long) run.population().size());
            meta.put(KEY_ARCHIVE_SIZE, (long) run.archive().size());
            meta.put(KEY_MAXIMIZE, run.maximize() ? 1L : 0L);

            MVMap<String, String> info = store.openMap("info");
            info.clear();
            if (run.terminationCause() != null) {
                info.put(KEY_TERMINATION, run.terminationCause());
            }

            MVMap<String, byte[]> rng = store.openMap("rng");
            rng.clear();
            if (run.rngState() != null) {
                rng.put("state", run.rngState().toBytes());
            }

            MVMap<Integer, byte[]> population = store.openMap("population");
            population.clear();
            saveIndividuals(run.population(), population);

            MVMap<Integer, byte[]> archive = store.openMap("archive");
            archive.clear();
            saveIndividuals(run.archive(), archive);

            store.commit();
        } catch (MVStoreException | IllegalStateException e) {
            throw new IOException("Cannot write " + path + ": " + e.getMessage(), e);
        }

        log.info("Run saved: {} generations, {} individuals, {} archived",
                run.generations(), run.population().size(), run.archive().size());
    }

    /**
     * Load a run from an MVStore file.
     */
    public static StoredRun load(Path path) throws IOException {
        log.info("Loading run from {} (MVStore)", path);

        try (MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .readOnly()
                .open()) {

            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            if (version < 1 || version > VERSION) {
                throw new IOException("Unsupported result version: " + version);
            }

            long generations = meta.getOrDefault(KEY_GENERATIONS, 0L);
            long evaluations = meta.getOrDefault(KEY_EVALUATIONS, 0L);
            long seed = meta.getOrDefault(KEY_SEED, 0L);
            boolean maximize = meta.getOrDefault(KEY_MAXIMIZE, 1L) != 0L;

            MVMap<String, String> info = store.openMap("info");
            String terminationCause = info.get(KEY_TERMINATION);

            MVMap<String, byte[]> rngMap = store.openMap("rng");
            byte[] rngBytes = rngMap.get("state");
            EvolutionRandom.State rngState = rngBytes != null ? EvolutionRandom.State.fromBytes(rngBytes) : null;

            List<Individual<List<Double>>> population = loadIndividuals(store.openMap("population"), maximize);
            List<Individual<List<Double>>> archive = loadIndividuals(store.openMap("archive"), maximize);

            log.info("Run loaded: {} generations, {} individuals (v{})", generations, population.size(), version);

            return new StoredRun(generations, evaluations, seed, maximize, terminationCause, rngState,
                    population, archive);
        } catch (MVStoreException | IllegalStateException e) {
            throw new IOException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Check if file is a readable result of a supported version.
     */
    public static boolean isValid(Path path) {
        try (MVStore store = new MVStore.Builder().fileName(path.toString()).readOnly().open()) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            return version >= 1 && version <= VERSION;
        } catch (Exception e) {
            log.debug("Not a result file: {}", path, e);
            return false;
        }
    }

    /**
     * One-line summary without loading the individuals.
     */
    public static String describe(Path path) {
        try (MVStore store = new MVStore.Builder().fileName(path.toString()).readOnly().open()) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            long generations = meta.getOrDefault(KEY_GENERATIONS, 0L);
            long evaluations = meta.getOrDefault(KEY_EVALUATIONS, 0L);
            long seed = meta.getOrDefault(KEY_SEED, 0L);
            long populationSize = meta.getOrDefault(KEY_POPULATION_SIZE, 0L);
            long archiveSize = meta.getOrDefault(KEY_ARCHIVE_SIZE, 0L);

            MVMap<String, String> info = store.openMap("info");
            String cause = info.getOrDefault(KEY_TERMINATION, "-");

            return String.format(
                "Result v%d: %,d generations, %,d evaluations, population %d, archive %d, seed=%d, stopped by %s",
                version, generations, evaluations, populationSize, archiveSize, seed, cause
            );
        } catch (Exception e) {
            return "Invalid result file: " + e.getMessage();
        }
    }

    // ========== Private helpers ==========

    private static void saveIndividuals(List<Individual<List<Double>>> individuals, MVMap<Integer, byte[]> map) {
        for (int i = 0; i < individuals.size(); i++) {
            map.put(i, serialize(individuals.get(i)));
        }
    }

    private static List<Individual<List<Double>>> loadIndividuals(MVMap<Integer, byte[]> map, boolean maximize) {
        List<Individual<List<Double>>> result = new ArrayList<>(map.size());
        for (Integer index : map.keySet()) {
            byte[] data = map.get(index);
            if (data != null) {
                result.add(deserialize(data, maximize));
            }
        }
        return result;
    }

    static byte[] serialize(Individual<List<Double>> individual) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {

            List<Double> candidate = individual.candidate();
            out.writeInt(candidate.size());
            for (double value : candidate) {
                out.writeDouble(value);
            }

            Fitness fitness = individual.requireFitness();
            if (fitness instanceof ScalarFitness scalar) {
                out.writeByte(SCALAR);
                out.writeDouble(scalar.value());
            } else if (fitness instanceof Pareto pareto) {
                out.writeByte(PARETO);
                out.writeInt(pareto.objectives());
                for (int i = 0; i < pareto.objectives(); i++) {
                    out.writeDouble(pareto.objective(i));
                    out.writeBoolean(pareto.maximizes(i));
                }
            } else {
                throw new IllegalArgumentException("Cannot store fitness of type " + fitness.getClass().getName());
            }
            out.writeLong(individual.birthdate());

            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static Individual<List<Double>> deserialize(byte[] data, boolean maximize) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(data);
             DataInputStream in = new DataInputStream(bais)) {

            int length = in.readInt();
            List<Double> candidate = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                candidate.add(in.readDouble());
            }

            byte kind = in.readByte();
            Fitness fitness;
            if (kind == SCALAR) {
                fitness = new ScalarFitness(in.readDouble());
            } else if (kind == PARETO) {
                int objectives = in.readInt();
                double[] values = new double[objectives];
                boolean[] polarity = new boolean[objectives];
                for (int i = 0; i < objectives; i++) {
                    values[i] = in.readDouble();
                    polarity[i] = in.readBoolean();
                }
                fitness = new Pareto(values, polarity);
            } else {
                throw new IOException("Unknown fitness kind: " + kind);
            }
            // birthdate is informational; a restored individual is born now
            in.readLong();

            return new Individual<>(candidate, fitness, maximize);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
