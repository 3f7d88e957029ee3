package io.polylog.core;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

/**
 * Source of default timestamps and suffixes for new ordering keys.
 *
 * Provides:
 *  - the system clock with a thread-safe RNG for normal operation
 *  - a fixed clock (EPOCH + seed seconds; UTC) and seeded L64X256MixRandom for reproducible runs
 */
public final class OrderingKeyGenerator {

    private static final OrderingKeyGenerator SYSTEM =
            new OrderingKeyGenerator(Clock.systemUTC(), RandomGeneratorFactory.of("L64X256MixRandom").create());

    private final Clock clock;
    private final RandomGenerator rng;

    public OrderingKeyGenerator(Clock clock, RandomGenerator rng) {
        this.clock = Objects.requireNonNull(clock);
        this.rng = Objects.requireNonNull(rng);
    }

    /** Wall clock, randomly seeded suffixes. */
    public static OrderingKeyGenerator system() { return SYSTEM; }

    /**
     * Deterministic generator.
     * Clock = EPOCH + seed seconds (UTC), RNG = L64X256MixRandom(seed).
     */
    public static OrderingKeyGenerator deterministic(long seed) {
        var fixedClock = Clock.fixed(Instant.EPOCH.plusSeconds(seed), ZoneOffset.UTC);
        return new OrderingKeyGenerator(fixedClock, RandomGeneratorFactory.of("L64X256MixRandom").create(seed));
    }

    /** Current time in microseconds since epoch. */
    public long nowMicros() {
        Instant now = clock.instant();
        return TimeUnit.SECONDS.toMicros(now.getEpochSecond()) + TimeUnit.NANOSECONDS.toMicros(now.getNano());
    }

    // RandomGenerator implementations are generally not thread-safe
    public synchronized int nextSuffix() { return rng.nextInt(OrderingKey.MAX_SUFFIX + 1); }

    /** Key for {@code timestamp}/{@code suffix}, filling whichever is null. */
    public OrderingKey keyFor(Long timestamp, Integer suffix) {
        return new OrderingKey(timestamp != null ? timestamp : nowMicros(), suffix != null ? suffix : nextSuffix());
    }
}
