package com.psiscript.backend;

/**
 * 编译配置
 */
public class CompileOptions {
    private String register;
    private boolean buildSchedule = false;
    private boolean filterPulses = true;

    public CompileOptions() {
    }

    /** 目标寄存器，null 表示第一个声明的寄存器 */
    public String getRegister() {
        return register;
    }

    public void setRegister(String register) {
        this.register = register;
    }

    public boolean isBuildSchedule() {
        return buildSchedule;
    }

    public void setBuildSchedule(boolean buildSchedule) {
        this.buildSchedule = buildSchedule;
    }

    /**
     * 脉冲调度表是否只保留目标寄存器的事件
     */
    public boolean isFilterPulses() {
        return filterPulses;
    }

    public void setFilterPulses(boolean filterPulses) {
        this.filterPulses = filterPulses;
    }
}
