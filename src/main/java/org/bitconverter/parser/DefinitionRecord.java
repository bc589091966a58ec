package org.bitconverter.parser;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * 结构读取器的产物：各段的原始值和迁移行，保留源行号，尚未做任何语义校验。
 * 此类是不可变的。
 */
public final class DefinitionRecord {

    private final Map<SectionType, Integer> headerLines;
    private final Map<SectionType, List<DeclaredToken>> declarations;
    @Getter
    private final List<TransitionLine> transitions;

    DefinitionRecord(Map<SectionType, Integer> headerLines,
                     Map<SectionType, List<DeclaredToken>> declarations,
                     List<TransitionLine> transitions) {
        Objects.requireNonNull(headerLines, "Header lines cannot be null.");
        Objects.requireNonNull(declarations, "Declarations cannot be null.");
        EnumMap<SectionType, List<DeclaredToken>> copy = new EnumMap<>(SectionType.class);
        declarations.forEach((type, tokens) -> copy.put(type, List.copyOf(tokens)));
        this.headerLines = Collections.unmodifiableMap(new EnumMap<>(headerLines));
        this.declarations = Collections.unmodifiableMap(copy);
        this.transitions = List.copyOf(Objects.requireNonNull(transitions, "Transitions cannot be null."));
    }

    public boolean hasSection(SectionType type) {
        return headerLines.containsKey(type);
    }

    /**
     * @return 段头所在的行号；段未声明时为空。
     */
    public OptionalInt getHeaderLine(SectionType type) {
        Integer line = headerLines.get(type);
        return line == null ? OptionalInt.empty() : OptionalInt.of(line);
    }

    /**
     * @return 某个声明段的全部值（按出现顺序）；段未声明时返回空列表。
     *         迁移段请使用 {@link #getTransitions()}。
     */
    public List<DeclaredToken> getTokens(SectionType type) {
        return declarations.getOrDefault(type, List.of());
    }

    @Override
    public String toString() {
        return "DefinitionRecord(sections=" + headerLines.keySet() + ", transitions=" + transitions.size() + ")";
    }
}
