package com.purchasingpower.codegraph.exception;

import lombok.Getter;

@Getter
public class ChangeDetectionException extends RuntimeException {

    private final String filePath;

    public ChangeDetectionException(String filePath, Throwable cause) {
        super("Failed to check modification time for " + filePath + ": " + cause.getMessage(), cause);
        this.filePath = filePath;
    }

    public ChangeDetectionException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }
}
