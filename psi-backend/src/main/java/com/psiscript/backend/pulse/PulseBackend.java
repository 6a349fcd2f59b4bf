package com.psiscript.backend.pulse;

/**
 * 脉冲调度表的回放接收端（硬件驱动、物理模拟器、日志收集器等）
 *
 * @param <R> {@link #onFinish} 返回的汇总类型
 */
public interface PulseBackend<R> {

    void onStart(PulseSchedule schedule);

    /** 按排序后的顺序，每个事件调用一次 */
    void onEvent(PulseEvent event);

    R onFinish(PulseSchedule schedule);
}
