package org.bitconverter.exceptions;

import lombok.Getter;

@Getter
public class UnknownSymbolException extends AutomatonException {

    private final String token;

    public UnknownSymbolException(int line, String token) {
        super(line, "symbol '" + token + "' is not in the alphabet");
        this.token = token;
    }

    public UnknownSymbolException(String token) {
        this(0, token);
    }
}
