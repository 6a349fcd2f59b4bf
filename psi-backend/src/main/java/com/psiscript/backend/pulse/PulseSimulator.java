package com.psiscript.backend.pulse;

/**
 * 回放驱动：onStart → 按序 onEvent → onFinish，返回 onFinish 的结果
 */
public class PulseSimulator<R> {

    private final PulseBackend<R> backend;

    public PulseSimulator(PulseBackend<R> backend) {
        this.backend = backend;
    }

    public R run(PulseSchedule schedule) {
        backend.onStart(schedule);
        for (PulseEvent event : schedule.getEvents()) {
            backend.onEvent(event);
        }
        return backend.onFinish(schedule);
    }
}
