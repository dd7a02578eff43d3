package io.chainsim.core;

import io.chainsim.core.metrics.SimulationMetrics;
import io.chainsim.core.report.RoundRecorder;
import io.chainsim.core.sim.Simulation;
import io.chainsim.core.sim.SimulationConfig;

import java.nio.file.Path;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }
        if (options.verbose()) {
            enableFineLogging();
        }

        SimulationConfig config = options.toConfig();
        LOG.info("Simulating " + config.nodeCount + " nodes for " + config.rounds + " rounds"
                + (config.seed != null ? " (seed " + config.seed + ")" : "")
                + (config.adoptMajority ? "" : " without majority adoption"));

        Simulation simulation = Simulation.fromConfig(config);
        RoundRecorder recorder = simulation.run();

        if (options.writeOutput()) {
            recorder.writeTo(options.outputPath());
        } else {
            LOG.info("Report file disabled (--no-output)");
        }
        LOG.info("=== Metrics ===\n" + SimulationMetrics.scrapeMetrics());
    }

    private static void enableFineLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            int nodes,
            int rounds,
            Long seed,
            Path outputPath,
            boolean writeOutput,
            boolean adoptMajority,
            boolean printChains,
            int hashPrefixLength,
            boolean verbose
    ) {
        static CliOptions parse(String[] args) {
            SimulationConfig defaults = SimulationConfig.defaultLocal();
            int nodes = defaults.nodeCount;
            int rounds = defaults.rounds;
            Long seed = defaults.seed;
            Path outputPath = envPath("CHAIN_SIM_OUTPUT", Path.of("consensus_data.json"));
            boolean writeOutput = !"false".equalsIgnoreCase(System.getenv("CHAIN_SIM_WRITE_OUTPUT"));
            boolean adoptMajority = defaults.adoptMajority;
            boolean printChains = defaults.printChains;
            int hashPrefixLength = defaults.hashPrefixLength;
            boolean verbose = false;
            boolean showHelp = false;
            String error = null;

            try {
                nodes = envInt("CHAIN_SIM_NODES", nodes, 1);
                rounds = envInt("CHAIN_SIM_ROUNDS", rounds, 0);
                String seedEnv = System.getenv("CHAIN_SIM_SEED");
                if (seedEnv != null && !seedEnv.isBlank()) {
                    seed = parseLong(seedEnv, "CHAIN_SIM_SEED");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--nodes=")) {
                        try {
                            nodes = parseInt(arg.substring("--nodes=".length()), "--nodes", 1);
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--rounds=")) {
                        try {
                            rounds = parseInt(arg.substring("--rounds=".length()), "--rounds", 0);
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--seed=")) {
                        try {
                            seed = parseLong(arg.substring("--seed=".length()), "--seed");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--hash-prefix=")) {
                        try {
                            hashPrefixLength = parseInt(arg.substring("--hash-prefix=".length()), "--hash-prefix", 1);
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--output=")) {
                        outputPath = Path.of(arg.substring("--output=".length()));
                        writeOutput = true;
                    } else if (arg.equals("--no-output")) {
                        writeOutput = false;
                    } else if (arg.equals("--no-adopt")) {
                        adoptMajority = false;
                    } else if (arg.equals("--quiet")) {
                        printChains = false;
                    } else if (arg.equals("--verbose")) {
                        verbose = true;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            return new CliOptions(
                    showHelp,
                    error,
                    nodes,
                    rounds,
                    seed,
                    outputPath,
                    writeOutput,
                    adoptMajority,
                    printChains,
                    hashPrefixLength,
                    verbose
            );
        }

        SimulationConfig toConfig() {
            return new SimulationConfig(nodes, rounds, seed, hashPrefixLength, adoptMajority, printChains);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: chain-consensus-sim [options]

Options:
  --help, -h                 Show this help message and exit
  --nodes=<n>                Number of simulated nodes (default 5)
  --rounds=<n>               Number of consensus rounds (default 5)
  --seed=<long>              Seed for block ids and selection (default: unseeded)
  --output=<path>            Report file (default ./consensus_data.json)
  --no-output                Do not write the report file
  --hash-prefix=<n>          Characters of each tip id kept in the report (default 6)
  --no-adopt                 Skip the majority adoption pass (forks stay visible)
  --quiet                    Do not log every node's chain after each round
  --verbose                  Log round tallies and other FINE output

Environment overrides:
  CHAIN_SIM_NODES            Override --nodes default
  CHAIN_SIM_ROUNDS           Override --rounds default
  CHAIN_SIM_SEED             Override --seed default
  CHAIN_SIM_OUTPUT           Override --output default
  CHAIN_SIM_WRITE_OUTPUT     Set to "false" to skip the report file without CLI flag
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int envInt(String key, int fallback, int min) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parseInt(value, key, min);
        }

        private static int parseInt(String value, String flag, int min) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < min) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static long parseLong(String value, String flag) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
