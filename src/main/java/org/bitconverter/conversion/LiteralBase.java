package org.bitconverter.conversion;

/**
 * 输入字面量的进制标记。
 */
public enum LiteralBase {

    BINARY(2),
    DECIMAL(10),
    HEXADECIMAL(16),
    /** 以逗号或空白分隔、按原样与字母表匹配的记号列表。 */
    TOKENS(0);

    private final int radix;

    LiteralBase(int radix) {
        this.radix = radix;
    }

    /**
     * @return 进制基数；{@link #TOKENS} 没有基数，返回 0。
     */
    public int getRadix() {
        return radix;
    }
}
