package com.psiscript.compiler;

/**
 * 致命的编译错误：未声明寄存器、目标下标越界等。抛出后不产生任何部分输出。
 */
public class CompileException extends RuntimeException {

    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
