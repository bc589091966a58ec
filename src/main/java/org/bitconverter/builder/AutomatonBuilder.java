package org.bitconverter.builder;

import org.apache.commons.lang3.tuple.Pair;
import org.bitconverter.automata.base.Alphabet;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.automata.base.Transition;
import org.bitconverter.automata.models.DFA;
import org.bitconverter.exceptions.AutomatonException;
import org.bitconverter.exceptions.DuplicateDeclarationException;
import org.bitconverter.exceptions.MissingInitialStateException;
import org.bitconverter.exceptions.NondeterminismException;
import org.bitconverter.exceptions.UndeclaredStateException;
import org.bitconverter.exceptions.UnknownSymbolException;
import org.bitconverter.parser.DeclaredToken;
import org.bitconverter.parser.DefinitionRecord;
import org.bitconverter.parser.SectionType;
import org.bitconverter.parser.TransitionLine;
import org.bitconverter.utils.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把结构记录解析为经过校验的 {@link DFA}。
 * <p>
 * 构建是全有或全无的：遇到第一个致命错误即停止，后续检查依赖一致的状态集和字母表。
 * 不可达状态和缺失迁移只作为警告记录，不会导致构建失败。
 */
public class AutomatonBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AutomatonBuilder.class);

    /**
     * 构建 DFA。
     *
     * @param record 结构读取器的输出。
     * @return 成功时为 DFA，否则为只含第一个致命错误的失败结果。
     */
    public Result<DFA> build(DefinitionRecord record) {
        try {
            return Result.success(buildOrThrow(record));
        } catch (AutomatonException e) {
            logger.error("构建自动机失败: {}", e.getMessage());
            return Result.failure(e);
        }
    }

    private DFA buildOrThrow(DefinitionRecord record) {
        // 1. 状态集与字母表
        Map<String, State> states = declareStates(record.getTokens(SectionType.STATES));
        Alphabet alphabet = declareAlphabet(record.getTokens(SectionType.ALPHABET));

        // 2. 初始状态
        State initial = resolveInitial(record, states);

        // 3. 接受状态
        Set<State> accepting = resolveAccepting(record.getTokens(SectionType.ACCEPTING), states);

        // 4. 迁移
        List<Transition> transitions = resolveTransitions(record.getTransitions(), states, alphabet);

        DFA dfa = new DFA(new ArrayList<>(states.values()), alphabet, initial, accepting, transitions);

        // 5. 可达性，6. 完备性：仅提示
        if (!dfa.getUnreachableStates().isEmpty()) {
            logger.warn("从初始状态 {} 不可达的状态: {}", initial, dfa.getUnreachableStates());
        }
        if (!dfa.isComplete()) {
            logger.warn("自动机不完备，缺失 {} 个 (状态, 符号) 迁移: {}",
                    dfa.getIncompleteTransitions().size(), dfa.getIncompleteTransitions());
        }
        logger.info("构建完成: {}", dfa);
        return dfa;
    }

    private Map<String, State> declareStates(List<DeclaredToken> tokens) {
        Map<String, State> states = new LinkedHashMap<>();
        for (DeclaredToken token : tokens) {
            if (states.putIfAbsent(token.getValue(), State.of(token.getValue())) != null) {
                throw new DuplicateDeclarationException(token.getLine(), "state", token.getValue());
            }
        }
        return states;
    }

    private Alphabet declareAlphabet(List<DeclaredToken> tokens) {
        Map<String, Symbol> symbols = new LinkedHashMap<>();
        for (DeclaredToken token : tokens) {
            if (symbols.putIfAbsent(token.getValue(), Symbol.of(token.getValue())) != null) {
                throw new DuplicateDeclarationException(token.getLine(), "symbol", token.getValue());
            }
        }
        return Alphabet.of(new ArrayList<>(symbols.values()));
    }

    private State resolveInitial(DefinitionRecord record, Map<String, State> states) {
        List<DeclaredToken> tokens = record.getTokens(SectionType.INITIAL);
        if (tokens.size() != 1) {
            int line = tokens.isEmpty()
                    ? record.getHeaderLine(SectionType.INITIAL).orElse(0)
                    : tokens.get(1).getLine();
            throw new MissingInitialStateException(line, tokens.size());
        }
        DeclaredToken token = tokens.get(0);
        return lookupState(states, token.getValue(), token.getLine(), "initial");
    }

    private Set<State> resolveAccepting(List<DeclaredToken> tokens, Map<String, State> states) {
        Set<State> accepting = new LinkedHashSet<>();
        for (DeclaredToken token : tokens) {
            State state = lookupState(states, token.getValue(), token.getLine(), "accepting");
            if (!accepting.add(state)) {
                throw new DuplicateDeclarationException(token.getLine(), "accepting state", token.getValue());
            }
        }
        if (accepting.isEmpty()) {
            logger.info("没有接受状态，自动机不接受任何输入");
        }
        return accepting;
    }

    private List<Transition> resolveTransitions(List<TransitionLine> lines, Map<String, State> states,
                                                Alphabet alphabet) {
        Map<Pair<State, Symbol>, TransitionLine> seen = new HashMap<>();
        List<Transition> transitions = new ArrayList<>();
        for (TransitionLine line : lines) {
            State source = lookupState(states, line.getSource(), line.getLine(), "transition source");
            Symbol symbol = alphabet.getSymbolByLabel(line.getSymbol())
                    .orElseThrow(() -> new UnknownSymbolException(line.getLine(), line.getSymbol()));
            State target = lookupState(states, line.getTarget(), line.getLine(), "transition target");

            TransitionLine previous = seen.putIfAbsent(Pair.of(source, symbol), line);
            if (previous != null) {
                if (previous.getTarget().equals(line.getTarget())) {
                    throw new DuplicateDeclarationException(line.getLine(), "transition",
                            line.getSource() + ", " + line.getSymbol() + " -> " + line.getTarget());
                }
                throw new NondeterminismException(line.getLine(), line.getSource(), line.getSymbol(),
                        previous.getTarget(), previous.getLine(), line.getTarget());
            }
            transitions.add(new Transition(source, symbol, target));
        }
        return transitions;
    }

    private static State lookupState(Map<String, State> states, String label, int line, String context) {
        State state = states.get(label);
        if (state == null) {
            throw new UndeclaredStateException(line, label, context);
        }
        return state;
    }
}
