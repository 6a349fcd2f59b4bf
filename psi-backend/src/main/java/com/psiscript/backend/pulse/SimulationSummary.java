package com.psiscript.backend.pulse;

import java.util.Locale;

/**
 * 回放汇总
 */
public final class SimulationSummary {
    private final int eventCount;
    private final double durationNs;

    public SimulationSummary(int eventCount, double durationNs) {
        this.eventCount = eventCount;
        this.durationNs = durationNs;
    }

    public int getEventCount() {
        return eventCount;
    }

    public double getDurationNs() {
        return durationNs;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "{event_count=%d, duration_ns=%.1f}", eventCount, durationNs);
    }
}
