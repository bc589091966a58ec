package org.bitconverter.parser;

import lombok.Getter;

import java.util.Objects;

/**
 * 未经校验的迁移声明：{@code source, symbol -> target}。
 */
@Getter
public final class TransitionLine {

    private final String source;
    private final String symbol;
    private final String target;
    private final int line;

    public TransitionLine(String source, String symbol, String target, int line) {
        this.source = Objects.requireNonNull(source, "Source cannot be null.");
        this.symbol = Objects.requireNonNull(symbol, "Symbol cannot be null.");
        this.target = Objects.requireNonNull(target, "Target cannot be null.");
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
        TransitionLine that = (TransitionLine) o;
        return line == that.line && source.equals(that.source)
                && symbol.equals(that.symbol) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, symbol, target, line);
    }

    @Override
    public String toString() {
        return String.format("%s, %s -> %s (line %d)", source, symbol, target, line);
    }
}
