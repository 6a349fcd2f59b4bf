package com.psiscript.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 调用参数：{@code key: value} 形式的具名参数，以及不带冒号的位置参数。
 *
 * <p>逗号只在括号（{@code ()}、{@code []}）深度为 0 时分隔参数，
 * 因此 {@code waveform: Gaussian(amp: 0.2, sigma: 4)} 整体作为一个值。</p>
 */
public final class ClauseArguments {

    private final Map<String, String> named;
    private final List<String> positional;

    private ClauseArguments(Map<String, String> named, List<String> positional) {
        this.named = named;
        this.positional = positional;
    }

    public static ClauseArguments parse(String args) {
        Map<String, String> named = new LinkedHashMap<>();
        List<String> positional = new ArrayList<>();
        for (String part : split(args)) {
            int colon = part.indexOf(':');
            if (colon < 0) {
                positional.add(part);
                continue;
            }
            String key = part.substring(0, colon).trim();
            String value = part.substring(colon + 1).trim();
            named.put(key, value);
        }
        return new ClauseArguments(named, positional);
    }

    static List<String> split(String args) {
        List<String> parts = new ArrayList<>();
        if (args == null) {
            return parts;
        }
        StringBuilder buf = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
            }
            if (c == ',' && depth == 0) {
                addPart(parts, buf);
                buf.setLength(0);
            } else {
                buf.append(c);
            }
        }
        addPart(parts, buf);
        return parts;
    }

    private static void addPart(List<String> parts, StringBuilder buf) {
        String part = buf.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
    }

    public String get(String key) {
        return named.get(key);
    }

    public String get(String key, String defaultValue) {
        String value = named.get(key);
        return value != null ? value : defaultValue;
    }

    public Map<String, String> getNamed() {
        return Collections.unmodifiableMap(named);
    }

    public List<String> getPositional() {
        return Collections.unmodifiableList(positional);
    }
}
