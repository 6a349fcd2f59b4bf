package com.psiscript.compiler.ast;

import java.util.Collections;
import java.util.List;

/**
 * 语句树节点：一个子句的原始文本及其花括号块内的子语句。
 *
 * <p>叶子子句的 children 为空列表。构建完成后不可变。</p>
 */
public final class Statement {
    private final String text;
    private final List<Statement> children;
    private final SourceLocation location;

    public Statement(String text, List<Statement> children, SourceLocation location) {
        this.text = text;
        this.children = Collections.unmodifiableList(children);
        this.location = location;
    }

    public Statement(String text, SourceLocation location) {
        this(text, Collections.<Statement>emptyList(), location);
    }

    public String getText() {
        return text;
    }

    public List<Statement> getChildren() {
        return children;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return children.isEmpty() ? text : text + " {" + children.size() + "}";
    }
}
