package org.bitconverter.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表 DFA 中的一个状态。
 * State 是不可变对象，只携带一个标签；两个状态相等当且仅当标签相同。
 */
public final class State {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    @Getter
    private final String label;

    private final int hashCode;

    private State(String label) {
        this.label = label;
        this.hashCode = Objects.hash(label);
        logger.debug("创建了一个State: {}", label);
    }

    /**
     * 工厂方法：根据标签创建状态。
     * @param label 状态标签，不能为空串。
     * @return 新的 State 实例。
     */
    public static State of(String label) {
        Objects.requireNonNull(label, "State label cannot be null");
        if (label.isBlank()) {
            throw new IllegalArgumentException("状态标签不能为空");
        }
        return new State(label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return label.equals(state.label);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return label;
    }
}
