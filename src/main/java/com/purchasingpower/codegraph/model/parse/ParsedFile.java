package com.purchasingpower.codegraph.model.parse;

import java.util.List;

/**
 * Parser output for one file.
 *
 * @param path         path relative to the repository root, '/' separated
 * @param content      file text, used for the content hash; may be null when unavailable
 * @param symbols      declared symbols
 * @param dependencies edges leaving symbols of this file
 * @param imports      import statements
 */
public record ParsedFile(
        String path,
        String content,
        List<ParsedSymbol> symbols,
        List<ParsedDependency> dependencies,
        List<ParsedImport> imports
) {

    public ParsedFile {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        imports = imports == null ? List.of() : List.copyOf(imports);
    }

    /**
     * A tracked file no parser could extract structure from.
     */
    public static ParsedFile empty(String path, String content) {
        return new ParsedFile(path, content, List.of(), List.of(), List.of());
    }
}
