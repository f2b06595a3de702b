package com.questrail.herald.config;

import com.questrail.herald.dispatch.AlertRouting;
import com.questrail.herald.dispatch.DeliveryRetryPolicy;
import com.questrail.herald.domain.BinReminderDriver;
import com.questrail.herald.domain.BudgetAccrualDriver;
import com.questrail.herald.domain.TrainWatchDriver;
import com.questrail.herald.domain.bins.BinReminderTimes;
import com.questrail.herald.schedule.SchedulerTimingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Aggregated configuration for the Herald runtime.
 *
 * <p>{@link #fromEnvironment()} reads {@code HERALD_*} environment variables
 * (falling back to system properties of the same name). Unset keys take the
 * defaults; malformed values are logged and also take the defaults.</p>
 */
public record HeraldConfig(
    Path stateDirectory,
    ZoneId zone,
    SchedulerTimingPolicy timing,
    DeliveryRetryPolicy deliveryRetry,
    Duration drainTimeout,
    BinReminderTimes binTimes,
    Duration binRecheckInterval,
    BigDecimal weeklyAllowance,
    int historyLimit,
    int writeAttempts,
    AlertRouting routing,
    Optional<String> defaultStation
) {
    private static final Logger log = LoggerFactory.getLogger(HeraldConfig.class);

    public static final String STATE_DIR = "HERALD_STATE_DIR";
    public static final String ZONE = "HERALD_ZONE";
    public static final String MAX_SLEEP_SECONDS = "HERALD_MAX_SLEEP_SECONDS";
    public static final String RETRY_DELAY_SECONDS = "HERALD_RETRY_DELAY_SECONDS";
    public static final String WATCH_POLL_SECONDS = "HERALD_WATCH_POLL_SECONDS";
    public static final String DELIVERY_MAX_ATTEMPTS = "HERALD_DELIVERY_MAX_ATTEMPTS";
    public static final String DELIVERY_INITIAL_BACKOFF_MS = "HERALD_DELIVERY_INITIAL_BACKOFF_MS";
    public static final String DELIVERY_MAX_BACKOFF_MS = "HERALD_DELIVERY_MAX_BACKOFF_MS";
    public static final String DRAIN_TIMEOUT_SECONDS = "HERALD_DRAIN_TIMEOUT_SECONDS";
    public static final String BIN_NIGHT_BEFORE = "HERALD_BIN_NIGHT_BEFORE";
    public static final String BIN_MORNING_OF = "HERALD_BIN_MORNING_OF";
    public static final String BIN_REFRESH = "HERALD_BIN_REFRESH";
    public static final String BIN_RECHECK_HOURS = "HERALD_BIN_RECHECK_HOURS";
    public static final String WEEKLY_ALLOWANCE = "HERALD_WEEKLY_ALLOWANCE";
    public static final String HISTORY_LIMIT = "HERALD_HISTORY_LIMIT";
    public static final String WRITE_ATTEMPTS = "HERALD_WRITE_ATTEMPTS";
    public static final String BUDGET_RECIPIENT = "HERALD_BUDGET_RECIPIENT";
    public static final String BINS_RECIPIENT = "HERALD_BINS_RECIPIENT";
    public static final String TRAIN_RECIPIENT = "HERALD_TRAIN_RECIPIENT";
    public static final String DEFAULT_STATION = "HERALD_DEFAULT_STATION";

    public HeraldConfig {
        Objects.requireNonNull(stateDirectory, "stateDirectory");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(timing, "timing");
        Objects.requireNonNull(deliveryRetry, "deliveryRetry");
        Objects.requireNonNull(drainTimeout, "drainTimeout");
        Objects.requireNonNull(binTimes, "binTimes");
        Objects.requireNonNull(binRecheckInterval, "binRecheckInterval");
        Objects.requireNonNull(weeklyAllowance, "weeklyAllowance");
        Objects.requireNonNull(routing, "routing");
        Objects.requireNonNull(defaultStation, "defaultStation");
        if (defaultStation.isPresent() && !TrainWatchDriver.isStationCode(defaultStation.get())) {
            throw new IllegalArgumentException("defaultStation must be a three-letter station code");
        }
        defaultStation = defaultStation.map(crs -> crs.trim().toUpperCase(Locale.ROOT));
        if (weeklyAllowance.signum() < 0) {
            throw new IllegalArgumentException("weeklyAllowance must be >= 0");
        }
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be > 0");
        }
        if (writeAttempts <= 0) {
            throw new IllegalArgumentException("writeAttempts must be > 0");
        }
    }

    public static HeraldConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the process environment, then system properties.
     */
    public static HeraldConfig fromEnvironment() {
        return fromEnvironment(key -> {
            String value = System.getenv(key);
            return value == null || value.isEmpty() ? System.getProperty(key) : value;
        });
    }

    /**
     * Reads configuration through {@code lookup}, which returns {@code null}
     * for unset keys.
     */
    public static HeraldConfig fromEnvironment(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        Env env = new Env(lookup);
        HeraldConfig d = defaults();

        SchedulerTimingPolicy timing = new SchedulerTimingPolicy(
                env.seconds(MAX_SLEEP_SECONDS, d.timing().maxSleep()),
                env.seconds(RETRY_DELAY_SECONDS, d.timing().retryDelay()),
                env.seconds(WATCH_POLL_SECONDS, d.timing().watchPollInterval()));

        DeliveryRetryPolicy retry = new DeliveryRetryPolicy(
                env.integer(DELIVERY_MAX_ATTEMPTS, d.deliveryRetry().maxAttempts()),
                env.millis(DELIVERY_INITIAL_BACKOFF_MS, d.deliveryRetry().initialBackoff()),
                d.deliveryRetry().multiplier(),
                env.millis(DELIVERY_MAX_BACKOFF_MS, d.deliveryRetry().maxBackoff()));

        BinReminderTimes binTimes = new BinReminderTimes(
                env.time(BIN_NIGHT_BEFORE, d.binTimes().nightBefore()),
                env.time(BIN_MORNING_OF, d.binTimes().morningOf()),
                env.time(BIN_REFRESH, d.binTimes().refresh()));

        AlertRouting.Builder routing = AlertRouting.builder();
        env.optional(BUDGET_RECIPIENT).ifPresent(r -> routing.route(BudgetAccrualDriver.DOMAIN, r));
        env.optional(BINS_RECIPIENT).ifPresent(r -> routing.route(BinReminderDriver.DOMAIN, r));
        env.optional(TRAIN_RECIPIENT).ifPresent(r -> routing.route(TrainWatchDriver.DOMAIN, r));

        return new HeraldConfig(
                env.optional(STATE_DIR).map(Path::of).orElse(d.stateDirectory()),
                env.zone(ZONE, d.zone()),
                timing,
                retry,
                env.seconds(DRAIN_TIMEOUT_SECONDS, d.drainTimeout()),
                binTimes,
                Duration.ofHours(env.integer(BIN_RECHECK_HOURS, (int) d.binRecheckInterval().toHours())),
                env.decimal(WEEKLY_ALLOWANCE, d.weeklyAllowance()),
                env.integer(HISTORY_LIMIT, d.historyLimit()),
                env.integer(WRITE_ATTEMPTS, d.writeAttempts()),
                routing.build(),
                env.station(DEFAULT_STATION));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path stateDirectory = Path.of("state");
        private ZoneId zone = ZoneId.of("Europe/London");
        private SchedulerTimingPolicy timing = SchedulerTimingPolicy.defaults();
        private DeliveryRetryPolicy deliveryRetry = DeliveryRetryPolicy.defaults();
        private Duration drainTimeout = Duration.ofSeconds(10);
        private BinReminderTimes binTimes = BinReminderTimes.defaults();
        private Duration binRecheckInterval = Duration.ofHours(12);
        private BigDecimal weeklyAllowance = new BigDecimal("5.00");
        private int historyLimit = 10;
        private int writeAttempts = 3;
        private AlertRouting routing = AlertRouting.empty();
        private Optional<String> defaultStation = Optional.empty();

        public Builder withStateDirectory(Path stateDirectory) {
            this.stateDirectory = stateDirectory;
            return this;
        }

        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder withTiming(SchedulerTimingPolicy timing) {
            this.timing = timing;
            return this;
        }

        public Builder withDeliveryRetry(DeliveryRetryPolicy deliveryRetry) {
            this.deliveryRetry = deliveryRetry;
            return this;
        }

        public Builder withDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder withBinTimes(BinReminderTimes binTimes) {
            this.binTimes = binTimes;
            return this;
        }

        public Builder withBinRecheckInterval(Duration interval) {
            this.binRecheckInterval = interval;
            return this;
        }

        public Builder withWeeklyAllowance(BigDecimal weeklyAllowance) {
            this.weeklyAllowance = weeklyAllowance;
            return this;
        }

        public Builder withHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
            return this;
        }

        public Builder withWriteAttempts(int writeAttempts) {
            this.writeAttempts = writeAttempts;
            return this;
        }

        public Builder withRouting(AlertRouting routing) {
            this.routing = routing;
            return this;
        }

        /**
         * @param crs station code, or {@code null} for none
         */
        public Builder withDefaultStation(String crs) {
            this.defaultStation = Optional.ofNullable(crs);
            return this;
        }

        public HeraldConfig build() {
            return new HeraldConfig(stateDirectory, zone, timing, deliveryRetry, drainTimeout, binTimes,
                    binRecheckInterval, weeklyAllowance, historyLimit, writeAttempts, routing, defaultStation);
        }
    }

    /**
     * Typed lookups with fallback to a default.
     */
    private record Env(Function<String, String> lookup) {

        Optional<String> optional(String key) {
            String value = lookup.apply(key);
            return value == null || value.isBlank()
                    ? Optional.empty()
                    : Optional.of(value.trim());
        }

        int integer(String key, int fallback) {
            return optional(key).map(v -> {
                try {
                    return Integer.parseInt(v);
                } catch (NumberFormatException e) {
                    return invalid(key, v, fallback);
                }
            }).orElse(fallback);
        }

        Duration seconds(String key, Duration fallback) {
            return optional(key).map(v -> {
                try {
                    return Duration.ofSeconds(Long.parseLong(v));
                } catch (NumberFormatException e) {
                    return invalid(key, v, fallback);
                }
            }).orElse(fallback);
        }

        Duration millis(String key, Duration fallback) {
            return optional(key).map(v -> {
                try {
                    return Duration.ofMillis(Long.parseLong(v));
                } catch (NumberFormatException e) {
                    return invalid(key, v, fallback);
                }
            }).orElse(fallback);
        }

        BigDecimal decimal(String key, BigDecimal fallback) {
            return optional(key).map(v -> {
                try {
                    return new BigDecimal(v);
                } catch (NumberFormatException e) {
                    return invalid(key, v, fallback);
                }
            }).orElse(fallback);
        }

        LocalTime time(String key, LocalTime fallback) {
            return optional(key).map(v -> {
                try {
                    return LocalTime.parse(v);
                } catch (DateTimeParseException e) {
                    return invalid(key, v, fallback);
                }
            }).orElse(fallback);
        }

        ZoneId zone(String key, ZoneId fallback) {
            return optional(key).map(v -> {
                try {
                    return ZoneId.of(v);
                } catch (DateTimeException e) {
                    return invalid(key, v, fallback);
                }
            }).orElse(fallback);
        }

        Optional<String> station(String key) {
            Optional<String> value = optional(key);
            if (value.isPresent() && !TrainWatchDriver.isStationCode(value.get())) {
                log.warn("Ignoring invalid {}='{}'; expected a three-letter station code", key, value.get());
                return Optional.empty();
            }
            return value;
        }

        private static <T> T invalid(String key, String value, T fallback) {
            log.warn("Ignoring invalid {}='{}'; using {}", key, value, fallback);
            return fallback;
        }
    }
}
