package org.bitconverter.report;

import lombok.Getter;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.simulation.Run;
import org.bitconverter.simulation.Verdict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一次调用的全部输出：自动机元数据、按输入顺序排列的运行记录、构建时的提示信息和统计。
 * 此类是不可变的。
 */
@Getter
public final class Report {

    private final AutomatonMetadata automaton;
    private final List<Run> runs;
    private final List<String> warnings;
    private final RunSummary summary;

    Report(AutomatonMetadata automaton, List<Run> runs, List<String> warnings) {
        this.automaton = Objects.requireNonNull(automaton, "Automaton metadata cannot be null.");
        this.runs = List.copyOf(Objects.requireNonNull(runs, "Runs cannot be null."));
        this.warnings = List.copyOf(Objects.requireNonNull(warnings, "Warnings cannot be null."));
        this.summary = RunSummary.of(this.runs);
    }

    /**
     * 把报告转换为只含 {@link String}、{@link Integer}、{@link List} 和 {@link Map} 的嵌套结构，
     * 供外部文档渲染器使用。键的顺序固定。
     */
    public Map<String, Object> toMap() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("automaton", automatonMap());

        List<Object> runMaps = new ArrayList<>(runs.size());
        for (Run run : runs) {
            runMaps.add(runMap(run));
        }
        root.put("runs", Collections.unmodifiableList(runMaps));
        root.put("warnings", warnings);

        Map<String, Object> summaryMap = new LinkedHashMap<>();
        summaryMap.put("total_runs", summary.getTotalRuns());
        summaryMap.put("accepted", summary.getAccepted());
        summaryMap.put("rejected", summary.getRejected());
        summaryMap.put("stuck", summary.getStuck());
        root.put("summary", Collections.unmodifiableMap(summaryMap));
        return Collections.unmodifiableMap(root);
    }

    private Map<String, Object> automatonMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("states", automaton.getStates());
        map.put("alphabet", automaton.getAlphabet());
        map.put("initial", automaton.getInitial());
        map.put("accepting", automaton.getAccepting());
        map.put("unreachable_states", automaton.getUnreachableStates());
        map.put("incomplete_transitions", automaton.getIncompleteTransitions().stream()
                .map(p -> Map.of("state", p.getLeft(), "symbol", p.getRight()))
                .toList());
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, Object> runMap(Run run) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("input_literal", run.getInputLiteral());
        map.put("input_symbols", run.getInputSymbols().stream().map(Symbol::getLabel).toList());
        map.put("visited_states", run.getVisitedStates().stream().map(State::getLabel).toList());
        map.put("verdict", run.getVerdict().getDisplayName());
        if (run.getVerdict() == Verdict.STUCK) {
            map.put("unconsumed_suffix", run.getUnconsumedSuffix().stream().map(Symbol::getLabel).toList());
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "Report(runs=" + runs.size() + ", warnings=" + warnings.size() + ", " + summary + ")";
    }
}
