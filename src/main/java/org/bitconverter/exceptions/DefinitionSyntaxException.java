package org.bitconverter.exceptions;

import lombok.Getter;

/**
 * 定义文本的结构错误：未知段头、重复段、记号数量不对等。
 */
@Getter
public class DefinitionSyntaxException extends AutomatonException {

    private final String reason;

    public DefinitionSyntaxException(int line, String reason) {
        super(line, reason);
        this.reason = reason;
    }
}
