package com.psiscript.compiler.ast;

/**
 * 源码位置信息
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;

    public SourceLocation(String file, int line, int column, int offset) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
