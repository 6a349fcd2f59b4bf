package com.psiscript.backend.pulse;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.psiscript.compiler.op.OperationKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 脉冲调度表：按 (开始时间, 寄存器, 目标下标) 排序的事件集合。
 *
 * <p>总时长是派生值：max(start + duration)，空表为 0。</p>
 */
public final class PulseSchedule {

    private static final Gson GSON = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    private final List<PulseEvent> events;

    public PulseSchedule(List<PulseEvent> events) {
        List<PulseEvent> sorted = new ArrayList<>(events);
        sorted.sort(PulseEvent.ORDER);
        this.events = Collections.unmodifiableList(sorted);
    }

    public static PulseSchedule empty() {
        return new PulseSchedule(Collections.<PulseEvent>emptyList());
    }

    public List<PulseEvent> getEvents() {
        return events;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    public double getDurationNs() {
        double end = 0.0;
        for (PulseEvent event : events) {
            end = Math.max(end, event.getEndNs());
        }
        return events.isEmpty() ? 0.0 : end;
    }

    /**
     * 按通道（{@code q[0]} 或寄存器名）分组，组内按开始时间排序
     */
    public Map<String, List<PulseEvent>> perTarget() {
        Map<String, List<PulseEvent>> grouped = new LinkedHashMap<>();
        for (PulseEvent event : events) {
            grouped.computeIfAbsent(event.getChannelKey(), k -> new ArrayList<>()).add(event);
        }
        return grouped;
    }

    // ============ 序列化 ============

    /**
     * 序列化为 JSON 记录数组（字段名使用 snake_case，缺省字段输出为 null）
     */
    public String toJson() {
        JsonArray array = new JsonArray();
        for (PulseEvent event : events) {
            JsonObject obj = new JsonObject();
            obj.addProperty("kind", event.getKind().getLabel());
            obj.addProperty("register", event.getRegister());
            obj.addProperty("target", event.getTarget());
            obj.addProperty("start_ns", event.getStartNs());
            obj.addProperty("duration_ns", event.getDurationNs());
            obj.addProperty("axis", event.getAxis());
            obj.addProperty("angle", event.getAngle());
            obj.addProperty("shape", event.getShape());
            obj.addProperty("waveform", event.getWaveform());
            obj.addProperty("channel", event.getChannel());
            obj.addProperty("frequency", event.getFrequency());
            obj.addProperty("kernel", event.getKernel());
            obj.addProperty("when", event.getWhen());
            obj.addProperty("branch", event.getBranch());
            JsonObject metadata = new JsonObject();
            for (Map.Entry<String, String> entry : event.getMetadata().entrySet()) {
                metadata.addProperty(entry.getKey(), entry.getValue());
            }
            obj.add("metadata", metadata);
            obj.addProperty("raw", event.getRaw());
            array.add(obj);
        }
        return GSON.toJson(array);
    }

    /**
     * 渲染为定宽文本表，末行为总时长
     */
    public String toTable() {
        if (events.isEmpty()) {
            return "(no pulse events)";
        }
        List<String> lines = new ArrayList<>();
        String header = String.format(Locale.ROOT, "%10s %8s %6s %4s %10s details",
                "start(ns)", "dur(ns)", "reg", "tgt", "kind");
        lines.add(header);
        lines.add(repeat('-', header.length()));
        for (PulseEvent event : events) {
            String target = event.getTarget() == null ? "" : String.valueOf(event.getTarget());
            lines.add(String.format(Locale.ROOT, "%10.1f %8.1f %6s %4s %10s ",
                    event.getStartNs(), event.getDurationNs(), event.getRegister(), target,
                    event.getKind().getLabel()) + details(event));
        }
        lines.add(String.format(Locale.ROOT, "Total duration: %.1f ns", getDurationNs()));
        return String.join("\n", lines);
    }

    private static String details(PulseEvent event) {
        List<String> parts = new ArrayList<>();
        if (event.getAxis() != null) parts.add("axis=" + event.getAxis());
        if ((event.getKind() == OperationKind.ROTATE || event.getKind() == OperationKind.SHIFT_PHASE)
                && event.getAngle() != null) {
            parts.add("angle=" + event.getAngle());
        }
        if (event.getShape() != null) parts.add("shape=" + event.getShape());
        if (event.getWaveform() != null) parts.add("waveform=" + event.getWaveform());
        if (event.getChannel() != null) parts.add("channel=" + event.getChannel());
        if (event.getFrequency() != null) parts.add("freq=" + event.getFrequency());
        if (event.getKernel() != null) parts.add("kernel=" + event.getKernel());
        if (event.getBranch() != null) parts.add("branch=" + event.getBranch());
        return String.join(", ", parts);
    }

    private static String repeat(char c, int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "PulseSchedule{" + events.size() + " events, " + getDurationNs() + " ns}";
    }
}
