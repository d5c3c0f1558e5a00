package com.realtime.dm.client;

import java.time.Duration;

/**
 * 지수 백오프 (base * factor^n, 상한 cap). 연결에 성공하면 reset.
 */
public class ReconnectBackoff {

    public static final Duration DEFAULT_BASE = Duration.ofMillis(500);
    public static final Duration DEFAULT_CAP = Duration.ofSeconds(30);
    public static final double DEFAULT_FACTOR = 2.0;

    private final long baseMs;
    private final long capMs;
    private final double factor;
    private int attempts;

    public ReconnectBackoff() {
        this(DEFAULT_BASE, DEFAULT_FACTOR, DEFAULT_CAP);
    }

    public ReconnectBackoff(Duration base, double factor, Duration cap) {
        if (base.isNegative() || base.isZero()) throw new IllegalArgumentException("base must be positive");
        if (factor < 1.0) throw new IllegalArgumentException("factor must be >= 1");
        if (cap.compareTo(base) < 0) throw new IllegalArgumentException("cap must be >= base");
        this.baseMs = base.toMillis();
        this.capMs = cap.toMillis();
        this.factor = factor;
    }

    public synchronized Duration nextDelay() {
        double raw = baseMs * Math.pow(factor, attempts);
        if (attempts < 64) attempts++;
        return Duration.ofMillis((long) Math.min(capMs, raw));
    }

    public synchronized int attempts() {
        return attempts;
    }

    public synchronized void reset() {
        attempts = 0;
    }
}
