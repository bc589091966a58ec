package org.bitconverter.conversion;

import lombok.Getter;

import java.util.Locale;
import java.util.Objects;

/**
 * 一次模拟请求的输入：原始文本加上进制标记。
 * 此类是不可变的。
 */
@Getter
public final class InputLiteral {

    private final String text;
    private final LiteralBase base;

    private InputLiteral(String text, LiteralBase base) {
        this.text = Objects.requireNonNull(text, "Literal text cannot be null.");
        this.base = Objects.requireNonNull(base, "Literal base cannot be null.");
    }

    public static InputLiteral binary(String text) {
        return new InputLiteral(text, LiteralBase.BINARY);
    }

    public static InputLiteral decimal(String text) {
        return new InputLiteral(text, LiteralBase.DECIMAL);
    }

    public static InputLiteral hexadecimal(String text) {
        return new InputLiteral(text, LiteralBase.HEXADECIMAL);
    }

    public static InputLiteral tokens(String text) {
        return new InputLiteral(text, LiteralBase.TOKENS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        InputLiteral that = (InputLiteral) o;
        return text.equals(that.text) && base == that.base;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, base);
    }

    @Override
    public String toString() {
        return base.name().toLowerCase(Locale.ROOT) + ":" + text;
    }
}
