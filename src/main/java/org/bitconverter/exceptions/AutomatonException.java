package org.bitconverter.exceptions;

import lombok.Getter;

/**
 * 自动机定义、构建与输入转换过程中所有错误的公共父类。
 * 携带出错的源行号；与具体行无关的错误行号为 0。
 */
@Getter
public abstract class AutomatonException extends RuntimeException {

    private final int line;

    protected AutomatonException(int line, String message) {
        super(line > 0 ? "line " + line + ": " + message : message);
        this.line = line;
    }

    protected AutomatonException(int line, String message, Throwable cause) {
        super(line > 0 ? "line " + line + ": " + message : message, cause);
        this.line = line;
    }
}
