package com.psiscript.backend.pulse;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 时长文本解析：前导的带符号十进制/指数数字 + 可选单位（大小写不敏感），结果以纳秒计。
 *
 * <p>{@code dt} 是抽象时间步，按 1 计入同一数值字段。无单位视为纳秒，空文本或无法解析时为 0。</p>
 */
public final class DurationParser {

    private static final Pattern DURATION = Pattern.compile("([-+]?\\d*\\.?\\d+(?:[eE][-+]?\\d+)?)\\s*([a-zA-Z]+)?");

    private static final Map<String, Double> UNITS;

    static {
        Map<String, Double> map = new HashMap<>();
        map.put("s", 1e9);
        map.put("ms", 1e6);
        map.put("us", 1e3);
        map.put("ns", 1.0);
        map.put("ps", 1e-3);
        map.put("fs", 1e-6);
        map.put("dt", 1.0);
        UNITS = Collections.unmodifiableMap(map);
    }

    private DurationParser() {
    }

    public static double parse(String text) {
        if (text == null) {
            return 0.0;
        }
        Matcher m = DURATION.matcher(text.trim());
        if (!m.lookingAt()) {
            return 0.0;
        }
        double value = Double.parseDouble(m.group(1));
        String unit = m.group(2) == null ? "ns" : m.group(2).toLowerCase(Locale.ROOT);
        Double factor = UNITS.get(unit);
        // 未知单位按 1 处理
        return value * (factor != null ? factor : 1.0);
    }
}
