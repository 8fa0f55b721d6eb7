package com.purchasingpower.codegraph.model.parse;

import java.util.List;

/**
 * An import statement, e.g. {@code import { a, b } from 'lodash'}.
 */
public record ParsedImport(
        String source,
        List<String> importedNames,
        Integer lineNumber
) {
}
