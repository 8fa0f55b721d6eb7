package com.purchasingpower.codegraph.support;

import com.purchasingpower.codegraph.model.graph.DependencyType;
import com.purchasingpower.codegraph.model.graph.SymbolType;
import com.purchasingpower.codegraph.model.parse.ParsedDependency;
import com.purchasingpower.codegraph.model.parse.ParsedFile;
import com.purchasingpower.codegraph.model.parse.ParsedImport;
import com.purchasingpower.codegraph.model.parse.ParsedSymbol;
import com.purchasingpower.codegraph.parser.SourceParser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parser for TypeScript fixture files whose lines describe the parse result directly:
 *
 * <pre>
 * symbol|name|KIND|startLine|endLine|qualifiedName
 * dep|fromName|toName|KIND|line|parameterContext|callInstanceId|type1,type2
 * import|source|line
 * fail
 * </pre>
 *
 * Trailing fields are optional. Any other line is ignored.
 */
@Component
public class FixtureSourceParser implements SourceParser {

    @Override
    public boolean supports(String relativePath) {
        return relativePath.endsWith(".ts");
    }

    @Override
    public ParsedFile parse(Path root, String relativePath) throws IOException {
        String content = Files.readString(root.resolve(relativePath));

        List<ParsedSymbol> symbols = new ArrayList<>();
        List<ParsedDependency> dependencies = new ArrayList<>();
        List<ParsedImport> imports = new ArrayList<>();

        for (String line : content.split("\n")) {
            String[] f = line.trim().split("\\|", -1);
            switch (f[0]) {
                case "symbol" -> symbols.add(ParsedSymbol.builder()
                        .name(f[1])
                        .symbolType(SymbolType.valueOf(f[2]))
                        .startLine(Integer.valueOf(f[3]))
                        .endLine(Integer.valueOf(f[4]))
                        .qualifiedName(field(f, 5))
                        .exported(true)
                        .build());
                case "dep" -> dependencies.add(ParsedDependency.builder()
                        .fromSymbol(f[1])
                        .toSymbol(f[2])
                        .dependencyType(DependencyType.valueOf(f[3]))
                        .lineNumber(Integer.valueOf(f[4]))
                        .parameterContext(field(f, 5))
                        .callInstanceId(field(f, 6))
                        .parameterTypes(field(f, 7) != null ? Arrays.asList(f[7].split(",")) : null)
                        .build());
                case "import" -> imports.add(new ParsedImport(f[1], List.of(), Integer.valueOf(f[2])));
                case "fail" -> throw new IOException("Unparseable fixture: " + relativePath);
                default -> {
                    // free text
                }
            }
        }
        return new ParsedFile(relativePath, content, symbols, dependencies, imports);
    }

    private static String field(String[] fields, int index) {
        return fields.length > index && !fields[index].isEmpty() ? fields[index] : null;
    }
}
