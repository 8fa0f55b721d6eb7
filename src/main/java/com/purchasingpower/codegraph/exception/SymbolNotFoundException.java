package com.purchasingpower.codegraph.exception;

import lombok.Getter;

@Getter
public class SymbolNotFoundException extends RuntimeException {

    private final Long symbolId;

    public SymbolNotFoundException(Long symbolId) {
        super("Symbol not found: " + symbolId);
        this.symbolId = symbolId;
    }
}
