package org.bitconverter.simulation;

import org.apache.commons.lang3.tuple.Pair;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.automata.models.Automaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 在给定输入序列上执行自动机。
 * 引擎不持有任何可变状态，运行结果只取决于 (自动机, 输入)，因此可以在同一个自动机上并行运行。
 */
public class SimulationEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimulationEngine.class);

    /**
     * 运行一次模拟，字面量文本取符号标签的拼接。
     */
    public Run run(Automaton automaton, List<Symbol> input) {
        Objects.requireNonNull(input, "Input cannot be null.");
        String literal = input.stream().map(Symbol::getLabel).collect(Collectors.joining());
        return run(automaton, literal, input);
    }

    /**
     * 运行一次模拟。
     *
     * @param automaton    已校验的自动机。
     * @param inputLiteral 输入的原始文本，只用于报告。
     * @param input        已转换的符号序列。
     * @return 不可变的运行记录。
     */
    public Run run(Automaton automaton, String inputLiteral, List<Symbol> input) {
        Objects.requireNonNull(automaton, "Automaton cannot be null.");
        Objects.requireNonNull(input, "Input cannot be null.");

        State current = automaton.getInitialState();
        List<State> visited = new ArrayList<>(input.size() + 1);
        visited.add(current);

        for (int i = 0; i < input.size(); i++) {
            Symbol symbol = input.get(i);
            Optional<State> next = automaton.next(current, symbol);
            if (next.isEmpty()) {
                List<Symbol> suffix = input.subList(i, input.size());
                logger.debug("'{}' 在状态 {} 上没有符号 {} 的迁移，剩余输入 {}", inputLiteral, current, symbol, suffix);
                return new Run(inputLiteral, input, visited, Verdict.STUCK, suffix);
            }
            logger.debug("{} --[{}]--> {}", current, symbol, next.get());
            current = next.get();
            visited.add(current);
        }

        Verdict verdict = automaton.isAccepting(current) ? Verdict.ACCEPTED : Verdict.REJECTED;
        logger.debug("'{}' 结束于 {}: {}", inputLiteral, current, verdict.getDisplayName());
        return new Run(inputLiteral, input, visited, verdict, List.of());
    }

    /**
     * 并行运行多个输入，返回结果的顺序与输入顺序一致。
     *
     * @param inputs (字面量文本, 符号序列) 对的列表。
     */
    public List<Run> runAll(Automaton automaton, List<Pair<String, List<Symbol>>> inputs) {
        Objects.requireNonNull(automaton, "Automaton cannot be null.");
        Objects.requireNonNull(inputs, "Inputs cannot be null.");
        List<Run> runs = inputs.parallelStream()
                .map(input -> run(automaton, input.getLeft(), input.getRight()))
                .toList();
        logger.info("完成 {} 次模拟", runs.size());
        return runs;
    }
}
