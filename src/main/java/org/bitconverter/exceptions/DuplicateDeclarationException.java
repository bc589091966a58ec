package org.bitconverter.exceptions;

import lombok.Getter;

@Getter
public class DuplicateDeclarationException extends AutomatonException {

    /** 重复声明的对象种类，例如 "state"、"symbol"、"transition"。 */
    private final String kind;
    private final String label;

    public DuplicateDeclarationException(int line, String kind, String label) {
        super(line, "duplicate " + kind + " '" + label + "'");
        this.kind = kind;
        this.label = label;
    }
}
