package org.bitconverter.conversion;

import org.apache.commons.lang3.StringUtils;
import org.bitconverter.automata.base.Alphabet;
import org.bitconverter.automata.base.Symbol;
import org.bitconverter.exceptions.InvalidLiteralException;
import org.bitconverter.exceptions.UnknownSymbolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 把外部给定的字面量转换为自动机字母表中的符号序列。
 * <p>
 * 字母表恰好为 {0, 1} 时：二进制字面量逐位映射（最高位在前，保留前导零）；
 * 十进制和十六进制字面量先转换为最短的无符号二进制表示再逐位映射。
 * 字母表不是二进制时，字面量总是按逗号或空白切分成记号，与字母表逐个按原样匹配。
 * 此类无状态，可被多个线程共享。
 */
public class SymbolConverter {

    private static final Logger logger = LoggerFactory.getLogger(SymbolConverter.class);

    private static final String TOKEN_SEPARATORS = ", \t\r\n";
    private static final String DECIMAL_DIGITS = "0123456789";
    private static final String HEXADECIMAL_DIGITS = "0123456789abcdefABCDEF";

    /**
     * @throws InvalidLiteralException 字面量包含其进制之外的字符。
     * @throws UnknownSymbolException  记号不在字母表中。
     */
    public List<Symbol> convert(InputLiteral literal, Alphabet alphabet) {
        Objects.requireNonNull(literal, "Literal cannot be null.");
        Objects.requireNonNull(alphabet, "Alphabet cannot be null.");

        if (!alphabet.isBinary()) {
            if (literal.getBase() != LiteralBase.TOKENS) {
                logger.debug("字母表 {} 不是二进制，{} 按记号列表处理", alphabet, literal);
            }
            return tokenize(literal.getText(), alphabet);
        }

        String text = literal.getText().strip();
        List<Symbol> symbols = switch (literal.getBase()) {
            case BINARY -> bits(text, text);
            case DECIMAL -> bits(toBinaryString(text, text, LiteralBase.DECIMAL), text);
            case HEXADECIMAL -> bits(toBinaryString(text, stripHexPrefix(text), LiteralBase.HEXADECIMAL), text);
            case TOKENS -> tokenize(literal.getText(), alphabet);
        };
        logger.debug("{} 转换为 {}", literal, symbols);
        return symbols;
    }

    private List<Symbol> tokenize(String text, Alphabet alphabet) {
        List<Symbol> symbols = new ArrayList<>();
        for (String token : StringUtils.split(text, TOKEN_SEPARATORS)) {
            Symbol symbol = alphabet.getSymbolByLabel(token)
                    .orElseThrow(() -> new UnknownSymbolException(token));
            symbols.add(symbol);
        }
        return symbols;
    }

    private static List<Symbol> bits(String binary, String original) {
        List<Symbol> symbols = new ArrayList<>(binary.length());
        for (int i = 0; i < binary.length(); i++) {
            char c = binary.charAt(i);
            if (c != '0' && c != '1') {
                throw new InvalidLiteralException(original,
                        "character '" + c + "' at position " + i + " is not a binary digit");
            }
            symbols.add(Symbol.ofBit(c));
        }
        return symbols;
    }

    private static String toBinaryString(String original, String digits, LiteralBase base) {
        String name = base.name().toLowerCase(Locale.ROOT);
        if (digits.isEmpty()) {
            throw new InvalidLiteralException(original, "empty " + name + " literal");
        }
        // 只接受 ASCII 数字；BigInteger 会接受其他文字的数字
        String allowed = base == LiteralBase.DECIMAL ? DECIMAL_DIGITS : HEXADECIMAL_DIGITS;
        if (!StringUtils.containsOnly(digits, allowed)) {
            int i = StringUtils.indexOfAnyBut(digits, allowed);
            throw new InvalidLiteralException(original, "character '" + digits.charAt(i) + "' at position " + i
                    + " is not a " + name + " digit");
        }
        return new BigInteger(digits, base.getRadix()).toString(2);
    }

    private static String stripHexPrefix(String text) {
        return StringUtils.startsWithIgnoreCase(text, "0x") ? text.substring(2) : text;
    }
}
