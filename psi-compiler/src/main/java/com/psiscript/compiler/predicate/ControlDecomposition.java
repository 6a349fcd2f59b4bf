package com.psiscript.compiler.predicate;

import java.util.Collections;
import java.util.List;

/**
 * 谓词分解结果：有序控制列表，或"不支持"
 */
public final class ControlDecomposition {

    private static final ControlDecomposition UNSUPPORTED = new ControlDecomposition(null);
    private static final ControlDecomposition NONE = new ControlDecomposition(Collections.<Control>emptyList());

    private final List<Control> controls;

    private ControlDecomposition(List<Control> controls) {
        this.controls = controls;
    }

    public static ControlDecomposition of(List<Control> controls) {
        if (controls.isEmpty()) {
            return NONE;
        }
        return new ControlDecomposition(Collections.unmodifiableList(controls));
    }

    public static ControlDecomposition unsupported() {
        return UNSUPPORTED;
    }

    public boolean isSupported() {
        return controls != null;
    }

    /**
     * 控制列表，顺序与源码中的项一致
     *
     * @throws IllegalStateException 谓词不支持时
     */
    public List<Control> getControls() {
        if (controls == null) {
            throw new IllegalStateException("Predicate is not decomposable");
        }
        return controls;
    }

    public int size() {
        return controls == null ? 0 : controls.size();
    }

    @Override
    public String toString() {
        return controls == null ? "unsupported" : controls.toString();
    }
}
