package com.orderflow.sim;

import com.orderflow.core.logging.Logger;
import com.orderflow.core.logging.Slf4jLogger;
import com.orderflow.sim.config.SimulationConfig;
import com.orderflow.sim.tape.BalancesWriter;
import com.orderflow.sim.tape.TapeJournal;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * <b>The Experiment Runner.</b>
 * <p>
 * Composition root for a batch of trading days:
 * </p>
 *
 * <pre>
 * [SimulationConfig]
 *         |
 *         v
 * [Fixed pool] -> one MarketSession per day, Random(seed + day)
 *         |
 *    (finished tapes, any order)
 *         |
 *         v
 * [TapeJournal ring buffer] -> [journal thread] -> transactions CSV
 *
 * [balances, in day order] -> balances CSV
 * </pre>
 *
 * <p>
 * Sessions share no mutable state, so the pool size only changes how fast a
 * run finishes, never what it produces.
 * </p>
 */
public class ExperimentRunner {

    private final SimulationConfig config;
    private final Logger logger;

    public ExperimentRunner(SimulationConfig config) {
        this(config, new Slf4jLogger(ExperimentRunner.class));
    }

    public ExperimentRunner(SimulationConfig config, Logger logger) {
        this.config = config;
        this.logger = logger;
    }

    /**
     * Runs every configured day and writes the outputs.
     *
     * @return the closing balances, one per day in day order
     */
    public List<BalancesRecord> run() throws InterruptedException {
        TapeJournal journal = config.tapeFile() == null ? null : new TapeJournal(config.tapeFile());
        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism());
        try {
            List<Future<BalancesRecord>> days = new ArrayList<>(config.days());
            for (int day = 0; day < config.days(); day++) {
                days.add(pool.submit(dayTask(day, journal)));
            }

            List<BalancesRecord> results = new ArrayList<>(days.size());
            for (Future<BalancesRecord> day : days) {
                results.add(await(day));
            }
            writeBalances(results);
            return results;
        } finally {
            pool.shutdownNow();
            if (journal != null) {
                journal.close();
            }
        }
    }

    private Callable<BalancesRecord> dayTask(int day, TapeJournal journal) {
        return () -> {
            String sessionId = String.format("D%03d", day);
            MarketSession session = MarketSession.create(sessionId, config, new Random(config.seed() + day));
            session.run();
            if (journal != null) {
                journal.publishAll(session.tape().entries());
            }
            BalancesRecord balances = session.balances();
            logger.log("Day finished " + balances);
            return balances;
        };
    }

    private static BalancesRecord await(Future<BalancesRecord> day) throws InterruptedException {
        try {
            return day.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Session failed", cause);
        }
    }

    private void writeBalances(List<BalancesRecord> results) {
        if (config.balancesFile() == null) {
            return;
        }
        try (BalancesWriter writer = new BalancesWriter(config.balancesFile())) {
            for (BalancesRecord record : results) {
                writer.write(record);
            }
        }
    }

    public static void main(String[] args) throws Exception {
        SimulationConfig config = args.length > 0
                ? SimulationConfig.load(Paths.get(args[0]))
                : SimulationConfig.loadResource("simulation.json");
        Logger logger = new Slf4jLogger(ExperimentRunner.class);
        logger.warn("Running " + config);
        long start = System.nanoTime();
        List<BalancesRecord> results = new ExperimentRunner(config, logger).run();
        logger.warn(results.size() + " days completed, elapsed ms", (System.nanoTime() - start) / 1_000_000);
    }
}
