package org.bitconverter.exceptions;

import lombok.Getter;

@Getter
public class UndeclaredStateException extends AutomatonException {

    private final String state;

    public UndeclaredStateException(int line, String state, String context) {
        super(line, "state '" + state + "' referenced in " + context + " is not declared");
        this.state = state;
    }
}
