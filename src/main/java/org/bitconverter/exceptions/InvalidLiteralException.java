package org.bitconverter.exceptions;

import lombok.Getter;

/**
 * 输入字面量包含其进制之外的字符。
 */
@Getter
public class InvalidLiteralException extends AutomatonException {

    private final String literal;

    public InvalidLiteralException(String literal, String reason) {
        super(0, "invalid literal '" + literal + "': " + reason);
        this.literal = literal;
    }
}
