package org.bitconverter.parser;

import org.apache.commons.lang3.StringUtils;
import org.bitconverter.exceptions.DefinitionSyntaxException;
import org.bitconverter.utils.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把自动机定义文本读成 {@link DefinitionRecord}。
 * <p>
 * 文法（行式）：
 * <pre>
 * # 注释；'#' 之后的内容都被忽略，空行被忽略
 * states: q0, q1
 * alphabet: 0 1
 * initial: q0
 * accepting: q1
 * transitions:
 *   q0, 0 -> q0
 *   q0, 1 -> q1 ; q1, 0 -> q1
 * </pre>
 * 段头形如 {@code 名称:}，名称不区分大小写，冒号后可以直接跟值，值也可以延续到后续行直到下一个段头。
 * 值之间用逗号或空白分隔。迁移段中每条迁移为 {@code 源状态, 符号 -> 目标状态}，
 * 同一行中的多条迁移用 {@code ;} 分隔，箭头也可以写作 {@code →}。
 * <p>
 * 读取器在一趟扫描中收集所有结构错误，而不是遇到第一个就停止。
 */
public class DefinitionReader {

    private static final Logger logger = LoggerFactory.getLogger(DefinitionReader.class);

    private static final Pattern HEADER = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*:(.*)$");
    private static final Pattern ARROW = Pattern.compile("->|→");
    private static final String VALUE_SEPARATORS = ", \t";

    /**
     * 读取定义文本。
     *
     * @param text 定义文本，行分隔符可以是 \n 或 \r\n。
     * @return 成功时为结构记录，否则为按发现顺序排列的全部语法错误。
     */
    public Result<DefinitionRecord> read(String text) {
        Objects.requireNonNull(text, "Definition text cannot be null.");
        return new Pass(text).run();
    }

    /**
     * 一次读取的可变状态，只在 {@link #read(String)} 内部存在。
     */
    private static final class Pass {

        private final String[] lines;
        private final Map<SectionType, Integer> headerLines = new EnumMap<>(SectionType.class);
        private final Map<SectionType, List<DeclaredToken>> declarations = new EnumMap<>(SectionType.class);
        private final List<TransitionLine> transitions = new ArrayList<>();
        private final List<DefinitionSyntaxException> errors = new ArrayList<>();

        private SectionType current;
        // 未知段或重复段之后的内容行不再单独报错
        private boolean skipping;

        Pass(String text) {
            this.lines = text.split("\\r?\\n", -1);
        }

        Result<DefinitionRecord> run() {
            for (int i = 0; i < lines.length; i++) {
                readLine(lines[i], i + 1);
            }
            checkRequired(SectionType.STATES);
            checkRequired(SectionType.ALPHABET);

            if (!errors.isEmpty()) {
                logger.warn("定义文本中发现 {} 个语法错误", errors.size());
                errors.forEach(e -> logger.debug("  {}", e.getMessage()));
                return Result.failure(errors);
            }
            DefinitionRecord record = new DefinitionRecord(headerLines, declarations, transitions);
            logger.info("读取定义完成: {} 行, 段 {}, {} 条迁移", lines.length, headerLines.keySet(), transitions.size());
            return Result.success(record);
        }

        private void readLine(String raw, int lineNumber) {
            String line = StringUtils.substringBefore(raw, "#").strip();
            if (line.isEmpty()) {
                return;
            }
            Matcher header = HEADER.matcher(line);
            if (header.matches()) {
                openSection(header.group(1), lineNumber);
                String rest = header.group(2).strip();
                if (!rest.isEmpty() && !skipping) {
                    readContent(rest, lineNumber);
                }
                return;
            }
            if (skipping) {
                return;
            }
            if (current == null) {
                errors.add(new DefinitionSyntaxException(lineNumber, "content outside of any section: '" + line + "'"));
                return;
            }
            readContent(line, lineNumber);
        }

        private void openSection(String keyword, int lineNumber) {
            Optional<SectionType> type = SectionType.fromHeader(keyword);
            if (type.isEmpty()) {
                errors.add(new DefinitionSyntaxException(lineNumber, "unknown section '" + keyword + "'"));
                current = null;
                skipping = true;
                return;
            }
            Integer first = headerLines.putIfAbsent(type.get(), lineNumber);
            if (first != null) {
                errors.add(new DefinitionSyntaxException(lineNumber,
                        "duplicate section '" + type.get() + "' (first declared at line " + first + ")"));
                current = null;
                skipping = true;
                return;
            }
            current = type.get();
            skipping = false;
            if (current != SectionType.TRANSITIONS) {
                declarations.put(current, new ArrayList<>());
            }
            logger.debug("第 {} 行进入段 {}", lineNumber, current);
        }

        private void readContent(String content, int lineNumber) {
            if (current == SectionType.TRANSITIONS) {
                for (String segment : content.split(";")) {
                    if (!segment.isBlank()) {
                        readTransition(segment.strip(), lineNumber);
                    }
                }
                return;
            }
            List<DeclaredToken> tokens = declarations.get(current);
            for (String value : StringUtils.split(content, VALUE_SEPARATORS)) {
                tokens.add(new DeclaredToken(value, lineNumber));
            }
        }

        private void readTransition(String segment, int lineNumber) {
            String[] sides = ARROW.split(segment, -1);
            if (sides.length != 2) {
                errors.add(new DefinitionSyntaxException(lineNumber,
                        "expected 'source, symbol -> target', got '" + segment + "'"));
                return;
            }
            String[] left = StringUtils.split(sides[0], VALUE_SEPARATORS);
            String[] right = StringUtils.split(sides[1], VALUE_SEPARATORS);
            if (left.length != 2 || right.length != 1) {
                errors.add(new DefinitionSyntaxException(lineNumber, String.format(
                        "expected 2 tokens before '->' and 1 after, got %d and %d in '%s'",
                        left.length, right.length, segment)));
                return;
            }
            transitions.add(new TransitionLine(left[0], left[1], right[0], lineNumber));
        }

        private void checkRequired(SectionType type) {
            Integer line = headerLines.get(type);
            if (line == null) {
                errors.add(new DefinitionSyntaxException(0, "missing required section '" + type + "'"));
            } else if (declarations.get(type).isEmpty()) {
                errors.add(new DefinitionSyntaxException(line, "section '" + type + "' declares no values"));
            }
        }
    }
}
