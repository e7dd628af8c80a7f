package com.orderflow.sim.config;

import com.orderflow.sim.schedule.ScheduleSettings;
import com.orderflow.sim.schedule.StepMode;
import com.orderflow.sim.schedule.TimeMode;
import com.orderflow.sim.trader.ImpactParameters;
import com.orderflow.sim.trader.TraderType;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * <h1>Experiment Configuration</h1>
 *
 * <p>
 * Everything a run needs, read once before the first session starts. There is
 * no runtime reconfiguration.
 * </p>
 *
 * <pre>
 * {
 *   "days": 4, "parallelism": 2, "seed": 42, "sessionLength": 3000,
 *   "minPrice": 1, "maxPrice": 200, "depth": 3,
 *   "imbalance": {"threshold": 0.6, "window": 10, "scale": 5.0, "decay": 0.8,
 *                 "aggression": 0.8, "endgameFraction": 0.3},
 *   "population": {"buyers": {"GIVEAWAY": 5}, "sellers": {"SHAVER": 5}},
 *   "schedule": {"interval": 300, "timeMode": "DRIP_POISSON", "stepMode": "FIXED",
 *                "demand": [105, 105], "supply": [95, 95], "quantity": 1},
 *   "output": {"tape": "transactions.csv", "balances": "balances.csv"}
 * }
 * </pre>
 *
 * <p>
 * Missing keys fall back to the defaults shown. Trader types may be given by
 * constant name or short code ({@code "GVWY"}, {@code "ISHV"}, ...).
 * </p>
 */
public final class SimulationConfig {

    private final int days;
    private final int parallelism;
    private final long seed;
    private final long sessionLength;
    private final long minPrice;
    private final long maxPrice;
    private final ImpactParameters imbalance;
    private final Map<TraderType, Integer> buyers;
    private final Map<TraderType, Integer> sellers;
    private final ScheduleSettings schedule;
    private final Path tapeFile;
    private final Path balancesFile;

    private SimulationConfig(Builder builder) {
        this.days = builder.days;
        this.parallelism = builder.parallelism;
        this.seed = builder.seed;
        this.sessionLength = builder.sessionLength;
        this.minPrice = builder.minPrice;
        this.maxPrice = builder.maxPrice;
        this.imbalance = new ImpactParameters(builder.depth, builder.window, builder.threshold, builder.scale,
                builder.decay, builder.aggression, builder.endgameFraction);
        this.buyers = Collections.unmodifiableMap(new EnumMap<>(builder.buyers));
        this.sellers = Collections.unmodifiableMap(new EnumMap<>(builder.sellers));
        this.schedule = builder.schedule;
        this.tapeFile = builder.tapeFile;
        this.balancesFile = builder.balancesFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationConfig load(Path file) {
        try {
            return fromJson(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + file, e);
        }
    }

    public static SimulationConfig loadResource(String name) {
        try (InputStream in = SimulationConfig.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + name);
            }
            return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration resource " + name, e);
        }
    }

    public static SimulationConfig fromJson(String text) {
        try {
            return fromJson(new JSONObject(text));
        } catch (JSONException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    static SimulationConfig fromJson(JSONObject json) {
        Builder b = builder();
        b.days(json.optInt("days", b.days))
                .parallelism(json.optInt("parallelism", b.parallelism))
                .seed(json.optLong("seed", b.seed))
                .sessionLength(json.optLong("sessionLength", b.sessionLength))
                .priceRange(json.optLong("minPrice", b.minPrice), json.optLong("maxPrice", b.maxPrice))
                .depth(json.optInt("depth", b.depth));

        JSONObject imbalance = json.optJSONObject("imbalance");
        if (imbalance != null) {
            b.threshold(imbalance.optDouble("threshold", b.threshold))
                    .window(imbalance.optInt("window", b.window))
                    .scale(imbalance.optDouble("scale", b.scale))
                    .decay(imbalance.optDouble("decay", b.decay))
                    .aggression(imbalance.optDouble("aggression", b.aggression))
                    .endgameFraction(imbalance.optDouble("endgameFraction", b.endgameFraction));
        }

        JSONObject population = json.optJSONObject("population");
        if (population == null) {
            throw new ConfigurationException("Configuration has no population");
        }
        readPopulation(population.optJSONObject("buyers"), b.buyers);
        readPopulation(population.optJSONObject("sellers"), b.sellers);

        JSONObject schedule = json.optJSONObject("schedule");
        if (schedule != null) {
            b.schedule(readSchedule(schedule));
        }

        JSONObject output = json.optJSONObject("output");
        if (output != null) {
            String tape = output.optString("tape", null);
            String balances = output.optString("balances", null);
            b.tapeFile(tape == null ? null : Paths.get(tape));
            b.balancesFile(balances == null ? null : Paths.get(balances));
        }
        return b.build();
    }

    private static void readPopulation(JSONObject side, Map<TraderType, Integer> into) {
        if (side == null) {
            return;
        }
        for (String key : side.keySet()) {
            TraderType type;
            try {
                type = TraderType.fromName(key);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
            into.merge(type, side.getInt(key), Integer::sum);
        }
    }

    private static ScheduleSettings readSchedule(JSONObject json) {
        ScheduleSettings d = ScheduleSettings.DEFAULTS;
        long[] demand = readRange(json.optJSONArray("demand"), d.demandMin(), d.demandMax());
        long[] supply = readRange(json.optJSONArray("supply"), d.supplyMin(), d.supplyMax());
        TimeMode timeMode;
        StepMode stepMode;
        try {
            timeMode = TimeMode.valueOf(json.optString("timeMode", d.timeMode().name()).toUpperCase()
                    .replace('-', '_'));
            stepMode = StepMode.valueOf(json.optString("stepMode", d.stepMode().name()).toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown schedule mode: " + e.getMessage(), e);
        }
        return new ScheduleSettings(json.optLong("interval", d.interval()), timeMode, stepMode, demand[0], demand[1],
                supply[0], supply[1], json.optLong("quantity", d.quantity()));
    }

    private static long[] readRange(JSONArray range, long low, long high) {
        if (range == null) {
            return new long[] {low, high};
        }
        if (range.length() != 2) {
            throw new ConfigurationException("A price range needs exactly two bounds: " + range);
        }
        return new long[] {range.getLong(0), range.getLong(1)};
    }

    public int days() {
        return days;
    }

    public int parallelism() {
        return parallelism;
    }

    public long seed() {
        return seed;
    }

    public long sessionLength() {
        return sessionLength;
    }

    public long minPrice() {
        return minPrice;
    }

    public long maxPrice() {
        return maxPrice;
    }

    /** Book depth the imbalance signal and the market views use. */
    public int depth() {
        return imbalance.depth();
    }

    public ImpactParameters imbalance() {
        return imbalance;
    }

    public Map<TraderType, Integer> buyers() {
        return buyers;
    }

    public Map<TraderType, Integer> sellers() {
        return sellers;
    }

    public ScheduleSettings schedule() {
        return schedule;
    }

    /** Null when the tape is not journaled. */
    public Path tapeFile() {
        return tapeFile;
    }

    /** Null when balances are not written. */
    public Path balancesFile() {
        return balancesFile;
    }

    @Override
    public String toString() {
        return "SimulationConfig{days=" + days + ", parallelism=" + parallelism + ", seed=" + seed + ", length="
                + sessionLength + ", prices=[" + minPrice + "," + maxPrice + "], " + imbalance + ", buyers=" + buyers
                + ", sellers=" + sellers + ", " + schedule + '}';
    }

    public static final class Builder {
        private int days = 1;
        private int parallelism = 1;
        private long seed = 42;
        private long sessionLength = 3000;
        private long minPrice = 1;
        private long maxPrice = 200;
        private int depth = ImpactParameters.DEFAULTS.depth();
        private int window = ImpactParameters.DEFAULTS.window();
        private double threshold = ImpactParameters.DEFAULTS.threshold();
        private double scale = ImpactParameters.DEFAULTS.scale();
        private double decay = ImpactParameters.DEFAULTS.decay();
        private double aggression = ImpactParameters.DEFAULTS.aggression();
        private double endgameFraction = ImpactParameters.DEFAULTS.endgameFraction();
        private final EnumMap<TraderType, Integer> buyers = new EnumMap<>(TraderType.class);
        private final EnumMap<TraderType, Integer> sellers = new EnumMap<>(TraderType.class);
        private ScheduleSettings schedule = ScheduleSettings.DEFAULTS;
        private Path tapeFile;
        private Path balancesFile;

        private Builder() {
        }

        public Builder days(int days) {
            this.days = days;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder sessionLength(long sessionLength) {
            this.sessionLength = sessionLength;
            return this;
        }

        public Builder priceRange(long minPrice, long maxPrice) {
            this.minPrice = minPrice;
            this.maxPrice = maxPrice;
            return this;
        }

        public Builder depth(int depth) {
            this.depth = depth;
            return this;
        }

        public Builder window(int window) {
            this.window = window;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder scale(double scale) {
            this.scale = scale;
            return this;
        }

        public Builder decay(double decay) {
            this.decay = decay;
            return this;
        }

        public Builder aggression(double aggression) {
            this.aggression = aggression;
            return this;
        }

        public Builder endgameFraction(double endgameFraction) {
            this.endgameFraction = endgameFraction;
            return this;
        }

        public Builder buyers(TraderType type, int count) {
            buyers.merge(type, count, Integer::sum);
            return this;
        }

        public Builder sellers(TraderType type, int count) {
            sellers.merge(type, count, Integer::sum);
            return this;
        }

        public Builder schedule(ScheduleSettings schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder tapeFile(Path tapeFile) {
            this.tapeFile = tapeFile;
            return this;
        }

        public Builder balancesFile(Path balancesFile) {
            this.balancesFile = balancesFile;
            return this;
        }

        /**
         * @throws ConfigurationException when the settings cannot run
         */
        public SimulationConfig build() {
            require(days > 0, "days must be positive: " + days);
            require(parallelism > 0, "parallelism must be positive: " + parallelism);
            require(sessionLength > 0, "sessionLength must be positive: " + sessionLength);
            require(minPrice > 0, "minPrice must be positive: " + minPrice);
            require(minPrice < maxPrice, "minPrice must be below maxPrice: " + minPrice + " >= " + maxPrice);
            require(depth > 0, "depth must be positive: " + depth);
            require(window > 0, "imbalance window must be positive: " + window);
            require(threshold >= 0, "imbalance threshold must not be negative: " + threshold);
            require(!Double.isNaN(scale) && !Double.isNaN(decay) && !Double.isNaN(aggression),
                    "imbalance parameters must be numbers");
            require(schedule.interval() > 0, "schedule interval must be positive: " + schedule.interval());
            require(schedule.quantity() > 0, "schedule quantity must be positive: " + schedule.quantity());
            int buyerCount = count(buyers, "buyers");
            int sellerCount = count(sellers, "sellers");
            require(buyerCount + sellerCount > 0, "population is empty");
            require(buyerCount > 0, "population has no buyers");
            require(sellerCount > 0, "population has no sellers");
            return new SimulationConfig(this);
        }

        private static int count(Map<TraderType, Integer> side, String name) {
            int total = 0;
            for (Map.Entry<TraderType, Integer> entry : side.entrySet()) {
                require(entry.getValue() >= 0, name + " count of " + entry.getKey() + " is negative");
                total += entry.getValue();
            }
            return total;
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new ConfigurationException(message);
            }
        }
    }
}
