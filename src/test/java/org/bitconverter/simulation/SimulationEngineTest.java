package org.bitconverter.simulation;

import org.apache.commons.lang3.tuple.Pair;
import org.bitconverter.automata.base.Alphabet;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.automata.base.Transition;
import org.bitconverter.automata.models.DFA;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SimulationEngineTest {

    private static State q0, q1;
    private static Alphabet binary;
    private static DFA parity;

    private final SimulationEngine engine = new SimulationEngine();

    @BeforeAll
    static void setUp() {
        q0 = State.of("q0");
        q1 = State.of("q1");
        binary = Alphabet.of("0", "1");
        parity = new DFA(List.of(q0, q1), binary, q0, Set.of(q1), List.of(
                new Transition(q0, Symbol.ZERO, q0),
                new Transition(q0, Symbol.ONE, q1),
                new Transition(q1, Symbol.ZERO, q1),
                new Transition(q1, Symbol.ONE, q0)));
    }

    private static List<Symbol> bits(String bits) {
        return bits.chars().mapToObj(c -> Symbol.ofBit((char) c)).toList();
    }

    @Nested
    @DisplayName("完备自动机 (Complete automaton)")
    class CompleteAutomatonTests {

        @Test
        @DisplayName("101 经过 [q0,q1,q1,q0]，偶数个 1 被拒绝")
        void testEvenOnesRejected() {
            Run run = engine.run(parity, bits("101"));

            assertAll(
                    () -> assertEquals(List.of(q0, q1, q1, q0), run.getVisitedStates()),
                    () -> assertEquals(Verdict.REJECTED, run.getVerdict()),
                    () -> assertTrue(run.getUnconsumedSuffix().isEmpty()),
                    () -> assertEquals("101", run.getInputLiteral())
            );
        }

        @Test
        @DisplayName("111 经过 [q0,q1,q0,q1]，奇数个 1 被接受")
        void testOddOnesAccepted() {
            Run run = engine.run(parity, bits("111"));

            assertAll(
                    () -> assertEquals(List.of(q0, q1, q0, q1), run.getVisitedStates()),
                    () -> assertEquals(Verdict.ACCEPTED, run.getVerdict()),
                    () -> assertEquals(q1, run.getFinalState()),
                    () -> assertEquals(3, run.getConsumedCount())
            );
        }

        @Test
        @DisplayName("同一输入运行两次应得到相同结果")
        void testRunIsPure() {
            List<Symbol> input = bits("1101001");
            assertEquals(engine.run(parity, "x", input), engine.run(parity, "x", input));
        }
    }

    @Nested
    @DisplayName("空输入 (Empty input)")
    class EmptyInputTests {

        @Test
        @DisplayName("初始状态不是接受状态时拒绝")
        void testInitialNotAccepting() {
            Run run = engine.run(parity, List.of());
            assertAll(
                    () -> assertEquals(List.of(q0), run.getVisitedStates()),
                    () -> assertEquals(Verdict.REJECTED, run.getVerdict())
            );
        }

        @Test
        @DisplayName("初始状态是接受状态时接受")
        void testInitialAccepting() {
            DFA acceptsEmpty = new DFA(List.of(q0), binary, q0, Set.of(q0), List.of());
            Run run = engine.run(acceptsEmpty, List.of());
            assertAll(
                    () -> assertEquals(List.of(q0), run.getVisitedStates()),
                    () -> assertEquals(Verdict.ACCEPTED, run.getVerdict())
            );
        }
    }

    @Nested
    @DisplayName("不完备自动机 (Incomplete automaton)")
    class StuckTests {

        @Test
        @DisplayName("q0 上缺少符号 1 的迁移时，输入 1 的结论为 Stuck")
        void testStuckOnFirstSymbol() {
            DFA partial = new DFA(List.of(q0, q1), binary, q0, Set.of(q1),
                    List.of(new Transition(q0, Symbol.ZERO, q1)));

            Run run = engine.run(partial, bits("1"));

            assertAll(
                    () -> assertEquals(Verdict.STUCK, run.getVerdict()),
                    () -> assertEquals(List.of(q0), run.getVisitedStates()),
                    () -> assertEquals(List.of(Symbol.ONE), run.getUnconsumedSuffix())
            );
        }

        @Test
        @DisplayName("中途卡住时保留剩余输入，即使卡住的状态是接受状态")
        void testStuckMidway() {
            DFA partial = new DFA(List.of(q0, q1), binary, q0, Set.of(q1),
                    List.of(new Transition(q0, Symbol.ZERO, q1)));

            Run run = engine.run(partial, bits("0011"));

            assertAll(
                    () -> assertEquals(Verdict.STUCK, run.getVerdict()),
                    () -> assertEquals(List.of(q0, q1), run.getVisitedStates()),
                    () -> assertEquals(bits("011"), run.getUnconsumedSuffix()),
                    () -> assertEquals(bits("0011"), run.getInputSymbols())
            );
        }
    }

    @Test
    @DisplayName("并行运行的结果应保持输入顺序，且与串行运行一致")
    void testRunAllPreservesOrder() {
        List<Pair<String, List<Symbol>>> inputs = new ArrayList<>();
        IntStream.range(0, 200).forEach(i -> {
            String literal = Integer.toBinaryString(i);
            inputs.add(Pair.of(literal, bits(literal)));
        });

        List<Run> runs = engine.runAll(parity, inputs);

        assertEquals(inputs.size(), runs.size());
        for (int i = 0; i < inputs.size(); i++) {
            Pair<String, List<Symbol>> input = inputs.get(i);
            Run expected = engine.run(parity, input.getLeft(), input.getRight());
            assertEquals(expected, runs.get(i));
            boolean oddOnes = Integer.bitCount(i) % 2 == 1;
            assertEquals(oddOnes ? Verdict.ACCEPTED : Verdict.REJECTED, runs.get(i).getVerdict());
        }
    }
}
