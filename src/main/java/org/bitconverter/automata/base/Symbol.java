package org.bitconverter.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 输入字母表中的一个原子符号，例如 {@code 0}、{@code 1} 或命名记号。
 * DFA 没有 ε 迁移，因此不允许空标签。
 */
@Getter
public final class Symbol {

    public static final Symbol ZERO = new Symbol("0");
    public static final Symbol ONE = new Symbol("1");

    private final String label;

    private final int hashCode;

    private Symbol(String label) {
        this.label = label;
        this.hashCode = Objects.hash(label);
    }

    public static Symbol of(String label) {
        Objects.requireNonNull(label, "Symbol label cannot be null");
        if (label.isBlank()) {
            throw new IllegalArgumentException("符号标签不能为空");
        }
        if (ZERO.label.equals(label)) {
            return ZERO;
        }
        if (ONE.label.equals(label)) {
            return ONE;
        }
        return new Symbol(label);
    }

    /**
     * 返回单个比特对应的符号。
     * @param bit 字符 '0' 或 '1'。
     */
    public static Symbol ofBit(char bit) {
        return switch (bit) {
            case '0' -> ZERO;
            case '1' -> ONE;
            default -> throw new IllegalArgumentException("不是比特字符: " + bit);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Symbol symbol = (Symbol) o;
        return label.equals(symbol.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return label;
    }
}
