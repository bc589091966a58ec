package org.bitconverter.automata.models;

import org.bitconverter.automata.base.Alphabet;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 模拟引擎所需的最小自动机视图。
 */
public interface Automaton {

    List<State> getStates();

    Alphabet getAlphabet();

    State getInitialState();

    Set<State> getAcceptingStates();

    /**
     * 迁移函数 δ(state, symbol)。
     * @return 目标状态；该 (状态, 符号) 对没有迁移时为空。
     */
    Optional<State> next(State state, Symbol symbol);

    default boolean isAccepting(State state) {
        return getAcceptingStates().contains(state);
    }
}
