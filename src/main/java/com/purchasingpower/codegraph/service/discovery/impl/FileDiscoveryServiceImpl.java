package com.purchasingpower.codegraph.service.discovery.impl;

import com.purchasingpower.codegraph.configuration.AppProperties;
import com.purchasingpower.codegraph.configuration.IngestionProperties;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.service.discovery.FileDiscoveryService;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import com.purchasingpower.codegraph.util.SourceFileClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class FileDiscoveryServiceImpl implements FileDiscoveryService {

    private final AppProperties appProperties;

    @Override
    public List<String> discover(Path repositoryRoot) throws IOException {
        Path root = repositoryRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toString(), null, "Repository root is not a directory");
        }
        IngestionProperties props = appProperties.getIngestion();
        Set<String> excluded = new HashSet<>(props.getExcludedDirectories());
        Set<String> extensions = new HashSet<>();
        props.getSupportedExtensions().forEach(ext -> extensions.add(ext.toLowerCase(Locale.ROOT)));

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.FILESYSTEM, "DiscoverFiles", log);
        ctx.logRequest("Walking repository tree", "Root", root, "Excluded", excluded);

        List<String> found = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    Path name = dir.getFileName();
                    if (name != null && excluded.contains(name.toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String relativePath = root.relativize(file.toAbsolutePath().normalize())
                            .toString()
                            .replace('\\', '/');
                    if (extensions.contains(SourceFileClassifier.extensionOf(relativePath))) {
                        found.add(relativePath);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    // Vanished between listing and visiting; the next run sees the final state
                    if (exc instanceof NoSuchFileException) {
                        log.debug("Skipping vanished file {}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    throw exc;
                }
            });
        } catch (IOException e) {
            ctx.logError("Failed to walk " + root, e);
            throw e;
        }

        Collections.sort(found);
        ctx.logResponse("Discovered source files", "Count", found.size());
        return found;
    }
}
