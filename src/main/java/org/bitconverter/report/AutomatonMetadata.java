package org.bitconverter.report;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.automata.models.DFA;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 报告渲染所需的自动机元数据，全部以标签表示，渲染器不需要了解自动机语义。
 */
@Getter
public final class AutomatonMetadata {

    private final List<String> states;
    private final List<String> alphabet;
    private final String initial;
    private final List<String> accepting;
    private final List<String> unreachableStates;
    /** 缺失迁移的 (状态, 符号) 对。 */
    private final List<Pair<String, String>> incompleteTransitions;

    private AutomatonMetadata(List<String> states, List<String> alphabet, String initial, List<String> accepting,
                              List<String> unreachableStates, List<Pair<String, String>> incompleteTransitions) {
        this.states = List.copyOf(states);
        this.alphabet = List.copyOf(alphabet);
        this.initial = Objects.requireNonNull(initial, "Initial state cannot be null.");
        this.accepting = List.copyOf(accepting);
        this.unreachableStates = List.copyOf(unreachableStates);
        this.incompleteTransitions = List.copyOf(incompleteTransitions);
    }

    public static AutomatonMetadata of(DFA dfa) {
        Objects.requireNonNull(dfa, "DFA cannot be null.");
        return new AutomatonMetadata(
                labels(dfa.getStates()),
                dfa.getAlphabet().getSymbols().stream().map(Symbol::getLabel).toList(),
                dfa.getInitialState().getLabel(),
                labels(dfa.getAcceptingStates()),
                labels(dfa.getUnreachableStates()),
                dfa.getIncompleteTransitions().stream()
                        .map(p -> Pair.of(p.getLeft().getLabel(), p.getRight().getLabel()))
                        .toList());
    }

    private static List<String> labels(Collection<State> states) {
        return states.stream().map(State::getLabel).toList();
    }
}
