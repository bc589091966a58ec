package org.bitconverter.simulation;

import lombok.Getter;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * 自动机在一个输入序列上的一次运行。
 * 访问轨迹以初始状态开头，之后每消耗一个符号追加一个状态；
 * 结论为 {@link Verdict#STUCK} 时，未消耗的后缀从第一个没有迁移的符号开始。
 * 此类是不可变的。
 */
@Getter
public final class Run {

    private final String inputLiteral;
    private final List<Symbol> inputSymbols;
    private final List<State> visitedStates;
    private final Verdict verdict;
    private final List<Symbol> unconsumedSuffix;

    public Run(String inputLiteral, List<Symbol> inputSymbols, List<State> visitedStates,
               Verdict verdict, List<Symbol> unconsumedSuffix) {
        this.inputLiteral = Objects.requireNonNull(inputLiteral, "Input literal cannot be null.");
        this.inputSymbols = List.copyOf(Objects.requireNonNull(inputSymbols, "Input symbols cannot be null."));
        this.visitedStates = List.copyOf(Objects.requireNonNull(visitedStates, "Visited states cannot be null."));
        this.verdict = Objects.requireNonNull(verdict, "Verdict cannot be null.");
        this.unconsumedSuffix = List.copyOf(Objects.requireNonNull(unconsumedSuffix, "Unconsumed suffix cannot be null."));
        if (this.visitedStates.isEmpty()) {
            throw new IllegalArgumentException("访问轨迹至少包含初始状态");
        }
        if (verdict != Verdict.STUCK && !this.unconsumedSuffix.isEmpty()) {
            throw new IllegalArgumentException("只有 STUCK 的运行才有未消耗的输入");
        }
    }

    public State getFinalState() {
        return visitedStates.get(visitedStates.size() - 1);
    }

    /**
     * @return 实际消耗的符号数。
     */
    public int getConsumedCount() {
        return visitedStates.size() - 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Run run = (Run) o;
        return inputLiteral.equals(run.inputLiteral)
                && inputSymbols.equals(run.inputSymbols)
                && visitedStates.equals(run.visitedStates)
                && verdict == run.verdict
                && unconsumedSuffix.equals(run.unconsumedSuffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputLiteral, inputSymbols, visitedStates, verdict, unconsumedSuffix);
    }

    @Override
    public String toString() {
        return "Run(input='" + inputLiteral + "', visited=" + visitedStates + ", verdict=" + verdict.getDisplayName()
                + (unconsumedSuffix.isEmpty() ? "" : ", unconsumed=" + unconsumedSuffix) + ")";
    }
}
