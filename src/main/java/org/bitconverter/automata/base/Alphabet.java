package org.bitconverter.automata.base;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 代表 DFA 的输入字母表。
 * Alphabet 是不可变对象，一旦创建，其包含的符号集合就不会改变。
 * 符号按声明顺序保存，报告中的输出顺序与定义文件一致。
 */
public final class Alphabet {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    private final List<Symbol> symbols;
    private final Map<String, Symbol> symbolsByLabel;
    private final boolean binary;
    private final int hashCode;

    /**
     * 私有构造函数，通过有序符号列表创建 Alphabet。
     * @param symbols 字母表中的全部符号，不能为空，不能重复。
     */
    private Alphabet(List<Symbol> symbols) {
        Objects.requireNonNull(symbols, "Symbols list cannot be null");
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("字母表不能为空。");
        }

        Map<String, Symbol> byLabel = new LinkedHashMap<>();
        for (Symbol symbol : symbols) {
            if (byLabel.putIfAbsent(symbol.getLabel(), symbol) != null) {
                logger.warn("Alphabet 包含重复的符号标签 {}。", symbol);
                throw new IllegalArgumentException("Alphabet 包含重复的符号标签: " + symbol);
            }
        }

        this.symbols = List.copyOf(symbols);
        this.symbolsByLabel = Collections.unmodifiableMap(byLabel);
        this.binary = byLabel.size() == 2 && byLabel.containsKey("0") && byLabel.containsKey("1");
        this.hashCode = Objects.hash(byLabel.keySet());
        logger.debug("创建 Alphabet，包含 {} 个符号。详情：{}", this.symbols.size(), this.symbols);
    }

    public static Alphabet of(List<Symbol> symbols) {
        return new Alphabet(symbols);
    }

    /**
     * 工厂方法：从一系列符号标签创建 Alphabet 实例。
     * @param labels 符号标签。
     * @return Alphabet 实例。
     */
    public static Alphabet of(String... labels) {
        return new Alphabet(Arrays.stream(labels).map(Symbol::of).toList());
    }

    /**
     * @return 声明顺序的符号列表（不可修改）。
     */
    public List<Symbol> getSymbols() {
        return symbols;
    }

    public Optional<Symbol> getSymbolByLabel(String label) {
        return Optional.ofNullable(symbolsByLabel.get(label));
    }

    public boolean contains(Symbol symbol) {
        return symbolsByLabel.containsKey(symbol.getLabel());
    }

    /**
     * 字母表是否恰好为 {0, 1}。
     */
    public boolean isBinary() {
        return binary;
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbolsByLabel.keySet().equals(alphabet.symbolsByLabel.keySet());
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{" +
                symbols.stream()
                        .map(Symbol::toString)
                        .collect(Collectors.joining(", ")) +
                '}';
    }
}
