package com.purchasingpower.codegraph.util;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Path-based facts about a source file: language, test and generated flags, content hash.
 */
public final class SourceFileClassifier {

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("vue", "vue"),
            Map.entry("php", "php"),
            Map.entry("cs", "csharp"),
            Map.entry("java", "java"),
            Map.entry("py", "python"),
            Map.entry("go", "go"),
            Map.entry("rb", "ruby"),
            Map.entry("kt", "kotlin"),
            Map.entry("rs", "rust"),
            Map.entry("gd", "godot")
    );

    private static final Set<String> TEST_DIRECTORIES = Set.of("__tests__", "test", "tests", "spec", "specs");

    private static final String[] GENERATED_DIRECTORIES = {"/generated/", "/.next/", "/dist/", "/build/"};

    private SourceFileClassifier() {
    }

    public static String extensionOf(String path) {
        String fileName = fileNameOf(path);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String detectLanguage(String path) {
        return LANGUAGES.getOrDefault(extensionOf(path), "unknown");
    }

    public static boolean isTestFile(String path) {
        String fileName = fileNameOf(path);
        if (fileName.contains(".test.") || fileName.contains(".spec.")) {
            return true;
        }
        String[] segments = path.replace('\\', '/').split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (TEST_DIRECTORIES.contains(segments[i])) {
                return true;
            }
        }
        return false;
    }

    public static boolean isGeneratedFile(String path) {
        String fileName = fileNameOf(path);
        if (fileName.contains(".generated.") || fileName.contains(".gen.")) {
            return true;
        }
        String normalized = "/" + path.replace('\\', '/');
        for (String marker : GENERATED_DIRECTORIES) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * SHA-256 of the file text, hex encoded; null when there is no content.
     */
    public static String contentHash(String content) {
        if (content == null) {
            return null;
        }
        return Hashing.sha256().hashString(content, StandardCharsets.UTF_8).toString();
    }

    private static String fileNameOf(String path) {
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }
}
