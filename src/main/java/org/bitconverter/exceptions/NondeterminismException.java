package org.bitconverter.exceptions;

import lombok.Getter;

/**
 * 同一 (状态, 符号) 对出现两个不同的目标状态。
 */
@Getter
public class NondeterminismException extends AutomatonException {

    private final String state;
    private final String symbol;
    private final String firstTarget;
    private final String secondTarget;
    private final int firstLine;

    public NondeterminismException(int line, String state, String symbol,
                                   String firstTarget, int firstLine, String secondTarget) {
        super(line, String.format("nondeterministic transition for (%s, %s): '%s' (line %d) and '%s'",
                state, symbol, firstTarget, firstLine, secondTarget));
        this.state = state;
        this.symbol = symbol;
        this.firstTarget = firstTarget;
        this.secondTarget = secondTarget;
        this.firstLine = firstLine;
    }
}
