package com.orderflow.sim.trader;

import java.util.Random;

/**
 * The closed set of strategy variants. Each constant knows how to build its
 * trader; the short code is what the balances record and the logs show.
 */
public enum TraderType {
    GIVEAWAY("GVWY") {
        @Override
        public Trader create(String id, Random random, ImpactParameters parameters) {
            return new GiveawayTrader(id, random);
        }
    },
    ZERO_INTELLIGENCE("ZIC") {
        @Override
        public Trader create(String id, Random random, ImpactParameters parameters) {
            return new ZeroIntelligenceTrader(id, random);
        }
    },
    SHAVER("SHVR") {
        @Override
        public Trader create(String id, Random random, ImpactParameters parameters) {
            return new ShaverTrader(id, random);
        }
    },
    SNIPER("SNPR") {
        @Override
        public Trader create(String id, Random random, ImpactParameters parameters) {
            return new SniperTrader(id, random);
        }
    },
    ZIP("ZIP") {
        @Override
        public Trader create(String id, Random random, ImpactParameters parameters) {
            return new ZipTrader(id, random);
        }
    },
    IMPACT_SENSITIVE("ISHV") {
        @Override
        public Trader create(String id, Random random, ImpactParameters parameters) {
            return new ImpactSensitiveTrader(id, random, parameters, false);
        }
    },
    IMPACT_SENSITIVE_FILTERED("ISHVF") {
        @Override
        public Trader create(String id, Random random, ImpactParameters parameters) {
            return new ImpactSensitiveTrader(id, random, parameters, true);
        }
    },
    IMPACT_ZIP("IZIP") {
        @Override
        public Trader create(String id, Random random, ImpactParameters parameters) {
            return new ImpactZipTrader(id, random, parameters);
        }
    };

    private final String code;

    TraderType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public abstract Trader create(String id, Random random, ImpactParameters parameters);

    /**
     * Looks a type up by constant name or short code, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static TraderType fromName(String name) {
        for (TraderType type : values()) {
            if (type.name().equalsIgnoreCase(name) || type.code.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trader type: " + name);
    }
}
