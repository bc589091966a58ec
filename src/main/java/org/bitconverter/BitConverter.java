package org.bitconverter;

import org.apache.commons.lang3.tuple.Pair;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.automata.models.DFA;
import org.bitconverter.builder.AutomatonBuilder;
import org.bitconverter.conversion.InputLiteral;
import org.bitconverter.conversion.SymbolConverter;
import org.bitconverter.parser.DefinitionLoader;
import org.bitconverter.parser.DefinitionReader;
import org.bitconverter.report.Report;
import org.bitconverter.report.ReportAssembler;
import org.bitconverter.simulation.Run;
import org.bitconverter.simulation.SimulationEngine;
import org.bitconverter.utils.Result;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * 串联整个流程：文本 → 结构记录 → DFA → (符号转换 + 模拟) → 运行记录 → 报告。
 * 各组件都无状态，一个实例可以被多个线程共享。
 */
public class BitConverter {

    private final DefinitionLoader loader;
    private final DefinitionReader reader;
    private final AutomatonBuilder builder;
    private final SymbolConverter converter;
    private final SimulationEngine engine;
    private final ReportAssembler assembler;

    public BitConverter() {
        this(new DefinitionLoader());
    }

    public BitConverter(DefinitionLoader loader) {
        this.loader = Objects.requireNonNull(loader, "Loader cannot be null.");
        this.reader = new DefinitionReader();
        this.builder = new AutomatonBuilder();
        this.converter = new SymbolConverter();
        this.engine = new SimulationEngine();
        this.assembler = new ReportAssembler();
    }

    /**
     * 读取并构建自动机，不抛出异常。
     * @return 成功时为 DFA；否则为读取器的全部语法错误，或构建器的第一个致命错误。
     */
    public Result<DFA> compile(String definition) {
        return reader.read(definition).flatMap(builder::build);
    }

    /**
     * @throws org.bitconverter.exceptions.AutomatonException 定义无效时。
     */
    public DFA parse(String definition) {
        return compile(definition).getOrThrow();
    }

    /**
     * 从文件读取并构建自动机。
     * @throws org.bitconverter.exceptions.DefinitionLoadException 文件无法读取时。
     */
    public DFA load(Path path) {
        return parse(loader.load(path));
    }

    public List<Symbol> convert(DFA dfa, InputLiteral literal) {
        return converter.convert(literal, dfa.getAlphabet());
    }

    public Run simulate(DFA dfa, InputLiteral literal) {
        return engine.run(dfa, literal.getText(), convert(dfa, literal));
    }

    /**
     * 转换并运行全部输入。任何一个字面量无法转换时立即抛出，不产生部分结果。
     */
    public List<Run> simulateAll(DFA dfa, List<InputLiteral> literals) {
        Objects.requireNonNull(literals, "Literals cannot be null.");
        List<Pair<String, List<Symbol>>> inputs = literals.stream()
                .map(literal -> Pair.of(literal.getText(), convert(dfa, literal)))
                .toList();
        return engine.runAll(dfa, inputs);
    }

    public Report report(DFA dfa, List<InputLiteral> literals) {
        return assembler.assemble(dfa, simulateAll(dfa, literals));
    }
}
