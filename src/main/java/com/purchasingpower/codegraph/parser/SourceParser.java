package com.purchasingpower.codegraph.parser;

import com.purchasingpower.codegraph.model.parse.ParsedFile;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Extracts symbols, dependencies and imports from one source file.
 *
 * Implementations are contributed as Spring beans, one per language or
 * framework; the first registered parser that supports a path wins.
 */
public interface SourceParser {

    /**
     * @param relativePath path relative to the repository root, '/' separated
     * @return true if this parser understands the file
     */
    boolean supports(String relativePath);

    /**
     * Parses a file.
     *
     * @param repositoryRoot absolute repository root
     * @param relativePath   path relative to the root, '/' separated
     * @return parsed structure; never null
     * @throws IOException if the file cannot be read
     */
    ParsedFile parse(Path repositoryRoot, String relativePath) throws IOException;
}
