package org.bitconverter.parser;

import lombok.Getter;

import java.util.Objects;

/**
 * 声明段中的一个值及其所在的源行号。
 */
@Getter
public final class DeclaredToken {

    private final String value;
    private final int line;

    public DeclaredToken(String value, int line) {
        this.value = Objects.requireNonNull(value, "Token value cannot be null.");
        this.line = line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DeclaredToken that = (DeclaredToken) o;
        return line == that.line && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, line);
    }

    @Override
    public String toString() {
        return value + "@" + line;
    }
}
