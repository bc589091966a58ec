package org.bitconverter.report;

import org.apache.commons.lang3.tuple.Pair;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.automata.models.DFA;
import org.bitconverter.simulation.Run;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把运行记录与自动机元数据汇总为 {@link Report}。
 * 不做任何校验，只按原顺序聚合。
 */
public class ReportAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ReportAssembler.class);

    public Report assemble(DFA dfa, List<Run> runs) {
        Objects.requireNonNull(dfa, "DFA cannot be null.");
        Objects.requireNonNull(runs, "Runs cannot be null.");

        List<String> warnings = new ArrayList<>();
        for (State state : dfa.getUnreachableStates()) {
            warnings.add("state '" + state.getLabel() + "' is unreachable from initial state '"
                    + dfa.getInitialState().getLabel() + "'");
        }
        for (Pair<State, Symbol> missing : dfa.getIncompleteTransitions()) {
            warnings.add("no transition for state '" + missing.getLeft().getLabel()
                    + "' on symbol '" + missing.getRight().getLabel() + "'");
        }

        Report report = new Report(AutomatonMetadata.of(dfa), runs, warnings);
        logger.info("生成报告: {}", report);
        return report;
    }
}
