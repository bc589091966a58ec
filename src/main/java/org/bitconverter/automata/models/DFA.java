package org.bitconverter.automata.models;

import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.bitconverter.automata.base.Alphabet;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.automata.base.Transition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 代表一个确定性有限自动机 (Deterministic Finite Automaton, DFA)。
 * DFA 实现了 Automaton 接口，并封装了其所有静态组件。
 * 此类是不可变的，构造完成后可以在多个模拟线程之间无锁共享。
 * <p>
 * 完备性不是不变量：缺失迁移的 (状态, 符号) 对被记录在 {@link #getIncompleteTransitions()} 中，
 * 不可达状态被记录在 {@link #getUnreachableStates()} 中，两者都只是提示信息。
 */
@Getter
public final class DFA implements Automaton {

    private final List<State> states;
    private final Alphabet alphabet;
    private final State initialState;
    private final Set<State> acceptingStates;
    private final List<Transition> transitions;
    private final List<State> unreachableStates;
    private final List<Pair<State, Symbol>> incompleteTransitions;

    @Getter(AccessLevel.NONE)
    private final Map<Pair<State, Symbol>, State> delta;

    /**
     * 构造一个 DFA。
     *
     * @param states          有序状态列表（声明顺序），不能为空。
     * @param alphabet        字母表。
     * @param initialState    初始状态，必须属于状态集。
     * @param acceptingStates 接受状态集，必须是状态集的子集，可以为空。
     * @param transitions     迁移列表，每个 (状态, 符号) 对至多一条。
     * @throws IllegalArgumentException 如果违反上述任一不变量。
     */
    public DFA(List<State> states, Alphabet alphabet, State initialState,
               Set<State> acceptingStates, List<Transition> transitions) {
        Objects.requireNonNull(states, "States list cannot be null.");
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        this.initialState = Objects.requireNonNull(initialState, "Initial state cannot be null.");
        Objects.requireNonNull(acceptingStates, "Accepting states set cannot be null.");
        Objects.requireNonNull(transitions, "Transitions list cannot be null.");

        if (states.isEmpty()) {
            throw new IllegalArgumentException("DFA 的状态集不能为空");
        }
        Set<State> declared = new LinkedHashSet<>(states);
        if (declared.size() != states.size()) {
            throw new IllegalArgumentException("DFA 的状态集包含重复状态: " + states);
        }
        if (!declared.contains(initialState)) {
            throw new IllegalArgumentException("初始状态 " + initialState + " 不在状态集中");
        }
        for (State accepting : acceptingStates) {
            if (!declared.contains(accepting)) {
                throw new IllegalArgumentException("接受状态 " + accepting + " 不在状态集中");
            }
        }

        Map<Pair<State, Symbol>, State> table = new LinkedHashMap<>();
        for (Transition t : transitions) {
            if (!declared.contains(t.getSource()) || !declared.contains(t.getTarget())) {
                throw new IllegalArgumentException("迁移 " + t + " 引用了未声明的状态");
            }
            if (!alphabet.contains(t.getSymbol())) {
                throw new IllegalArgumentException("迁移 " + t + " 引用了字母表之外的符号");
            }
            State previous = table.putIfAbsent(Pair.of(t.getSource(), t.getSymbol()), t.getTarget());
            if (previous != null && !previous.equals(t.getTarget())) {
                throw new IllegalArgumentException("迁移 " + t + " 与已有目标 " + previous + " 冲突");
            }
        }

        this.states = List.copyOf(states);
        this.acceptingStates = Collections.unmodifiableSet(new LinkedHashSet<>(acceptingStates));
        this.delta = Collections.unmodifiableMap(table);
        this.transitions = table.entrySet().stream()
                .map(e -> new Transition(e.getKey().getLeft(), e.getKey().getRight(), e.getValue()))
                .toList();
        this.unreachableStates = computeUnreachable();
        this.incompleteTransitions = computeIncomplete();
    }

    @Override
    public Optional<State> next(State state, Symbol symbol) {
        return Optional.ofNullable(delta.get(Pair.of(state, symbol)));
    }

    public boolean isComplete() {
        return incompleteTransitions.isEmpty();
    }

    /**
     * 从初始状态做广度优先搜索，返回按声明顺序排列的不可达状态。
     */
    private List<State> computeUnreachable() {
        Set<State> visited = new HashSet<>();
        Deque<State> queue = new ArrayDeque<>();
        visited.add(initialState);
        queue.add(initialState);
        while (!queue.isEmpty()) {
            State current = queue.poll();
            for (Symbol symbol : alphabet.getSymbols()) {
                State target = delta.get(Pair.of(current, symbol));
                if (target != null && visited.add(target)) {
                    queue.add(target);
                }
            }
        }
        return states.stream().filter(s -> !visited.contains(s)).toList();
    }

    private List<Pair<State, Symbol>> computeIncomplete() {
        List<Pair<State, Symbol>> missing = new ArrayList<>();
        for (State state : states) {
            for (Symbol symbol : alphabet.getSymbols()) {
                Pair<State, Symbol> key = Pair.of(state, symbol);
                if (!delta.containsKey(key)) {
                    missing.add(key);
                }
            }
        }
        return List.copyOf(missing);
    }

    @Override
    public String toString() {
        return "DFA(states=" + states + ", alphabet=" + alphabet + ", initial=" + initialState.getLabel()
                + ", accepting=" + acceptingStates + ")";
    }
}
