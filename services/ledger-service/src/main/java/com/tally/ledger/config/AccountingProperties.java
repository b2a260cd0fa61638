package com.tally.ledger.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Ledger settings bound from {@code accounting.*}. Immutable once bound.
 */
@Getter
@ConfigurationProperties(prefix = "accounting")
public class AccountingProperties {

    /**
     * ISO currency of the ledger; its minor unit fixes the scale of every amount.
     */
    private final String currency;

    /**
     * Equity account that receives the net result when a fiscal year is closed.
     */
    private final String retainedEarningsAccount;

    /**
     * Journal used when an entry is created without one.
     */
    private final String defaultJournal;

    /**
     * Archive the year's posted entries once the year is closed.
     */
    private final boolean archiveOnClose;

    private final Chart chart;
    private final Lock lock;
    private final Events events;
    private final Retry retry;

    public AccountingProperties(@DefaultValue("XOF") String currency,
                                @DefaultValue("121") String retainedEarningsAccount,
                                @DefaultValue("OD") String defaultJournal,
                                @DefaultValue("false") boolean archiveOnClose,
                                @DefaultValue Chart chart,
                                @DefaultValue Lock lock,
                                @DefaultValue Events events,
                                @DefaultValue Retry retry) {
        this.currency = currency;
        this.retainedEarningsAccount = retainedEarningsAccount;
        this.defaultJournal = defaultJournal;
        this.archiveOnClose = archiveOnClose;
        this.chart = chart;
        this.lock = lock;
        this.events = events;
        this.retry = retry;
    }

    @Getter
    public static class Chart {
        private final boolean seedEnabled;

        public Chart(@DefaultValue("true") boolean seedEnabled) {
            this.seedEnabled = seedEnabled;
        }
    }

    @Getter
    public static class Lock {
        /**
         * {@code redisson} for a cluster-wide lock, {@code local} for a single instance.
         */
        private final String provider;
        private final long waitTimeSeconds;
        private final long leaseTimeSeconds;

        public Lock(@DefaultValue("local") String provider,
                    @DefaultValue("30") long waitTimeSeconds,
                    @DefaultValue("120") long leaseTimeSeconds) {
            this.provider = provider;
            this.waitTimeSeconds = waitTimeSeconds;
            this.leaseTimeSeconds = leaseTimeSeconds;
        }
    }

    @Getter
    public static class Events {
        private final boolean enabled;
        private final String topic;

        public Events(@DefaultValue("false") boolean enabled,
                      @DefaultValue("ledger-events") String topic) {
            this.enabled = enabled;
            this.topic = topic;
        }
    }

    @Getter
    public static class Retry {
        private final int maxAttempts;
        private final long backoffMs;

        public Retry(@DefaultValue("3") int maxAttempts,
                     @DefaultValue("50") long backoffMs) {
            this.maxAttempts = maxAttempts;
            this.backoffMs = backoffMs;
        }
    }
}
