package org.netpreserve.domainprober;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.domainprober.config.ProbeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

public class DomainProber {
    private static final Logger log = LoggerFactory.getLogger(DomainProber.class);
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static volatile Thread shutdownHook;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Path jobDir = Path.of("data");
        String wordList = null;
        String suffixes = null;
        Integer comboLength = null;
        Integer maxComboLength = null;
        Integer workers = null;
        boolean noResume = false;
        boolean dumpConfig = false;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--combo-length" -> comboLength = Integer.parseInt(value(args, ++i));
                    case "--dict" -> wordList = value(args, ++i);
                    case "--dump-config" -> dumpConfig = true;
                    case "--job-dir", "-j" -> jobDir = Path.of(value(args, ++i));
                    case "--max-combo-length" -> maxComboLength = Integer.parseInt(value(args, ++i));
                    case "--no-resume" -> noResume = true;
                    case "--suffixes" -> suffixes = value(args, ++i);
                    case "--workers" -> workers = Integer.parseInt(value(args, ++i));
                    case "--help", "-h" -> {
                        printUsage();
                        return EXIT_OK;
                    }
                    default -> {
                        System.err.println("Unknown option: " + args[i]);
                        return EXIT_USAGE;
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        }

        ProbeConfig config;
        try {
            config = loadConfig(jobDir);
        } catch (IOException e) {
            log.error("Failed to load configuration", e);
            return EXIT_USAGE;
        }

        var candidates = config.candidates();
        if (wordList != null) candidates = candidates.withWordList(wordList);
        if (suffixes != null) candidates = candidates.withSuffixes(Arrays.stream(suffixes.split(","))
                .map(String::trim).filter(s -> !s.isEmpty()).toList());
        if (comboLength != null) candidates = candidates.withComboLength(comboLength);
        if (maxComboLength != null) candidates = candidates.withMaxComboLength(maxComboLength);
        config = config.withCandidates(candidates);
        if (workers != null) config = config.withProbe(config.probe().withWorkers(workers));
        if (noResume) config = config.withResume(false);

        if (dumpConfig) {
            try {
                System.out.println(newMapper().writeValueAsString(config));
            } catch (IOException e) {
                log.error("Failed to write configuration", e);
                return EXIT_FAILED;
            }
            return EXIT_OK;
        }

        Job job;
        try {
            job = new Job(jobDir, config);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        Thread hook = new Thread(() -> {
            try {
                job.close();
            } catch (Exception e) {
                System.err.println("Error shutting down: " + e.getMessage());
                e.printStackTrace(System.err);
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        shutdownHook = hook;

        try {
            job.run();
            return EXIT_OK;
        } catch (GenerationException e) {
            log.error("Failed to generate candidates", e);
            return EXIT_FAILED;
        } catch (PersistenceException e) {
            log.error("Failed to persist results", e);
            return EXIT_FAILED;
        } catch (UncheckedIOException e) {
            if (e.getCause() instanceof GenerationException) {
                log.error("Failed to generate candidates", e.getCause());
                return EXIT_FAILED;
            }
            throw e;
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        } catch (Job.BadStateException e) {
            log.error("Unable to start probing", e);
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_FAILED;
        } finally {
            job.close();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
                shutdownHook = null;
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, leaving shutdown hook in place", e);
            }
        }
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value for " + args[i - 1]);
        return args[i];
    }

    private static void printUsage() {
        System.out.println("Usage: domainprober [options]");
        System.out.println("Options:");
        System.out.println("      --combo-length N       Length of the shortest generated name");
        System.out.println("      --dict FILE            Word list to probe before the generated names");
        System.out.println("      --dump-config          Print the effective configuration and exit");
        System.out.println("  -h, --help");
        System.out.println("  -j, --job-dir DIR          Directory for job data (default: data)");
        System.out.println("      --max-combo-length N   Length of the longest generated name");
        System.out.println("      --no-resume            Start from the first candidate");
        System.out.println("      --suffixes a,b         Suffixes to append to every name (default: com)");
        System.out.println("      --workers N            Number of concurrent probes");
    }

    static ObjectMapper newMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Loads the built-in defaults overlaid with the job directory's config.yaml, if there is one.
     */
    static ProbeConfig loadConfig(Path jobDir) throws IOException {
        var mapper = newMapper();
        JsonNode configTree;
        try (InputStream defaults = DomainProber.class.getResourceAsStream("config/defaults.yaml")) {
            if (defaults == null) throw new IOException("config/defaults.yaml missing from classpath");
            configTree = mapper.readTree(defaults);
        }
        Path configFile = jobDir.resolve("config.yaml");
        if (Files.exists(configFile)) {
            JsonNode overrides = mapper.readTree(configFile.toFile());
            if (overrides != null && !overrides.isMissingNode()) {
                configTree = deepMerge(configTree, overrides);
            }
        }
        return mapper.treeToValue(configTree, ProbeConfig.class);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and lists are replaced outright
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode baseValue = merged.get(entry.getKey());
            merged.set(entry.getKey(), baseValue == null ? entry.getValue() : deepMerge(baseValue, entry.getValue()));
        });
        return merged;
    }
}
