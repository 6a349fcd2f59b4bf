package com.psiscript.backend.pulse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 收集回放事件，供检查或下游集成使用
 */
public class LoggingPulseBackend implements PulseBackend<SimulationSummary> {

    private static final Logger LOG = Logger.getLogger(LoggingPulseBackend.class.getName());

    private final List<PulseEvent> events = new ArrayList<>();
    private boolean started;
    private boolean finished;

    @Override
    public void onStart(PulseSchedule schedule) {
        events.clear();
        started = true;
        finished = false;
        LOG.fine("Replay started: " + schedule);
    }

    @Override
    public void onEvent(PulseEvent event) {
        events.add(event);
        LOG.fine("Pulse " + event);
    }

    @Override
    public SimulationSummary onFinish(PulseSchedule schedule) {
        finished = true;
        return new SimulationSummary(events.size(), schedule.getDurationNs());
    }

    public List<PulseEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isFinished() {
        return finished;
    }
}
