package org.bitconverter.exceptions;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 汇总多个错误的异常，由 {@link org.bitconverter.utils.Result#getOrThrow()} 在错误不止一个时抛出。
 */
@Getter
public class InvalidDefinitionException extends AutomatonException {

    private final List<AutomatonException> errors;

    public InvalidDefinitionException(List<? extends AutomatonException> errors) {
        super(0, errors.size() + " errors in automaton definition:\n" + errors.stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
    }
}
