package org.bitconverter.exceptions;

import lombok.Getter;

/**
 * 初始状态缺失，或声明了多于一个初始状态。
 */
@Getter
public class MissingInitialStateException extends AutomatonException {

    private final int declaredCount;

    public MissingInitialStateException(int line, int declaredCount) {
        super(line, declaredCount == 0
                ? "no initial state declared"
                : "exactly one initial state expected, found " + declaredCount);
        this.declaredCount = declaredCount;
    }
}
