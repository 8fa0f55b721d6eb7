package com.purchasingpower.codegraph.exception;

import lombok.Getter;

@Getter
public class RepositoryNotFoundException extends RuntimeException {

    private final String repository;

    public RepositoryNotFoundException(String repository) {
        super("Repository not found: " + repository);
        this.repository = repository;
    }
}
