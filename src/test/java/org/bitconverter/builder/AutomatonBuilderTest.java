package org.bitconverter.builder;

import org.apache.commons.lang3.tuple.Pair;
import org.bitconverter.automata.base.State;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.automata.models.DFA;
import org.bitconverter.exceptions.AutomatonException;
import org.bitconverter.exceptions.DuplicateDeclarationException;
import org.bitconverter.exceptions.MissingInitialStateException;
import org.bitconverter.exceptions.NondeterminismException;
import org.bitconverter.exceptions.UndeclaredStateException;
import org.bitconverter.exceptions.UnknownSymbolException;
import org.bitconverter.parser.DefinitionReader;
import org.bitconverter.utils.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AutomatonBuilderTest {

    private static final String PARITY = """
            states: q0, q1
            alphabet: 0, 1
            initial: q0
            accepting: q1
            transitions:
              q0, 0 -> q0
              q0, 1 -> q1
              q1, 0 -> q1
              q1, 1 -> q0
            """;

    private final DefinitionReader reader = new DefinitionReader();
    private final AutomatonBuilder builder = new AutomatonBuilder();

    private Result<DFA> build(String text) {
        return builder.build(reader.read(text).getOrThrow());
    }

    private <E extends AutomatonException> E buildFailure(String text, Class<E> type) {
        Result<DFA> result = build(text);
        assertFalse(result.isSuccess(), "construction should fail");
        assertEquals(1, result.getErrors().size(), "builder stops at the first fatal error");
        return assertInstanceOf(type, result.getErrors().get(0));
    }

    @Nested
    @DisplayName("成功构建 (Successful construction)")
    class SuccessTests {

        @Test
        @DisplayName("奇偶自动机应被完整构建")
        void testParityAutomaton() {
            DFA dfa = build(PARITY).getOrThrow();

            assertAll("parity automaton",
                    () -> assertEquals(List.of(State.of("q0"), State.of("q1")), dfa.getStates()),
                    () -> assertTrue(dfa.getAlphabet().isBinary()),
                    () -> assertEquals(State.of("q0"), dfa.getInitialState()),
                    () -> assertEquals(Set.of(State.of("q1")), dfa.getAcceptingStates()),
                    () -> assertEquals(4, dfa.getTransitions().size()),
                    () -> assertTrue(dfa.isComplete()),
                    () -> assertTrue(dfa.getUnreachableStates().isEmpty()),
                    () -> assertEquals(State.of("q0"), dfa.next(State.of("q1"), Symbol.ONE).orElseThrow())
            );
        }

        @Test
        @DisplayName("没有接受状态是合法的")
        void testEmptyAcceptingSet() {
            DFA dfa = build("""
                    states: q0
                    alphabet: a
                    initial: q0
                    accepting:
                    transitions:
                      q0, a -> q0
                    """).getOrThrow();
            assertTrue(dfa.getAcceptingStates().isEmpty());
        }

        @Test
        @DisplayName("不可达状态与缺失迁移只作为提示，不导致失败")
        void testAdvisoryFindings() {
            DFA dfa = build("""
                    states: q0, q1, dead
                    alphabet: 0, 1
                    initial: q0
                    accepting: q1
                    transitions:
                      q0, 0 -> q0
                      q1, 1 -> q1
                      dead, 0 -> q1
                    """).getOrThrow();

            assertAll(
                    () -> assertEquals(List.of(State.of("q1"), State.of("dead")), dfa.getUnreachableStates()),
                    () -> assertFalse(dfa.isComplete()),
                    () -> assertEquals(List.of(
                            Pair.of(State.of("q0"), Symbol.ONE),
                            Pair.of(State.of("q1"), Symbol.ZERO),
                            Pair.of(State.of("dead"), Symbol.ONE)), dfa.getIncompleteTransitions())
            );
        }
    }

    @Nested
    @DisplayName("致命错误 (Fatal errors)")
    class FatalErrorTests {

        @Test
        @DisplayName("同一 (状态, 符号) 对的第二个目标应报 NondeterminismException 并指出两个目标")
        void testNondeterminism() {
            NondeterminismException e = buildFailure(PARITY + "  q0, 1 -> q0\n", NondeterminismException.class);

            assertAll(
                    () -> assertEquals("q0", e.getState()),
                    () -> assertEquals("1", e.getSymbol()),
                    () -> assertEquals("q1", e.getFirstTarget()),
                    () -> assertEquals("q0", e.getSecondTarget()),
                    () -> assertEquals(7, e.getFirstLine()),
                    () -> assertEquals(10, e.getLine()),
                    () -> assertTrue(e.getMessage().contains("'q1'") && e.getMessage().contains("'q0'"))
            );
        }

        @Test
        @DisplayName("完全相同的迁移重复出现应报重复声明")
        void testRepeatedIdenticalTransition() {
            DuplicateDeclarationException e = buildFailure(PARITY + "  q0, 1 -> q1\n", DuplicateDeclarationException.class);
            assertEquals("transition", e.getKind());
        }

        @Test
        @DisplayName("重复的状态或符号应报重复声明")
        void testDuplicateStateAndSymbol() {
            DuplicateDeclarationException state = buildFailure("""
                    states: q0 q1 q0
                    alphabet: 0
                    initial: q0
                    """, DuplicateDeclarationException.class);
            DuplicateDeclarationException symbol = buildFailure("""
                    states: q0
                    alphabet: 0 1
                      1
                    initial: q0
                    """, DuplicateDeclarationException.class);

            assertAll(
                    () -> assertEquals("state", state.getKind()),
                    () -> assertEquals("q0", state.getLabel()),
                    () -> assertEquals("symbol", symbol.getKind()),
                    () -> assertEquals(3, symbol.getLine())
            );
        }

        @Test
        @DisplayName("缺少初始状态或有多个初始状态应报 MissingInitialStateException")
        void testInitialStateCount() {
            MissingInitialStateException none = buildFailure("""
                    states: q0
                    alphabet: 0
                    """, MissingInitialStateException.class);
            MissingInitialStateException two = buildFailure("""
                    states: q0 q1
                    alphabet: 0
                    initial: q0 q1
                    """, MissingInitialStateException.class);

            assertAll(
                    () -> assertEquals(0, none.getDeclaredCount()),
                    () -> assertEquals(2, two.getDeclaredCount()),
                    () -> assertEquals(3, two.getLine())
            );
        }

        @Test
        @DisplayName("引用未声明的状态应报 UndeclaredStateException")
        void testUndeclaredStates() {
            UndeclaredStateException initial = buildFailure("""
                    states: q0
                    alphabet: 0
                    initial: q9
                    """, UndeclaredStateException.class);
            UndeclaredStateException accepting = buildFailure("""
                    states: q0
                    alphabet: 0
                    initial: q0
                    accepting: q0 q7
                    """, UndeclaredStateException.class);
            UndeclaredStateException target = buildFailure("""
                    states: q0
                    alphabet: 0
                    initial: q0
                    transitions:
                      q0, 0 -> q5
                    """, UndeclaredStateException.class);

            assertAll(
                    () -> assertEquals("q9", initial.getState()),
                    () -> assertEquals("q7", accepting.getState()),
                    () -> assertEquals("q5", target.getState()),
                    () -> assertEquals(5, target.getLine())
            );
        }

        @Test
        @DisplayName("迁移使用字母表之外的符号应报 UnknownSymbolException")
        void testUndeclaredSymbol() {
            UnknownSymbolException e = buildFailure("""
                    states: q0
                    alphabet: 0
                    initial: q0
                    transitions:
                      q0, 2 -> q0
                    """, UnknownSymbolException.class);
            assertEquals("2", e.getToken());
        }
    }
}
