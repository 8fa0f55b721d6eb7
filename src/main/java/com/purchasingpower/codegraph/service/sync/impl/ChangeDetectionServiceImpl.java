package com.purchasingpower.codegraph.service.sync.impl;

import com.purchasingpower.codegraph.exception.ChangeDetectionException;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import com.purchasingpower.codegraph.model.sync.ChangeSet;
import com.purchasingpower.codegraph.repository.SourceFileRepository;
import com.purchasingpower.codegraph.service.discovery.FileDiscoveryService;
import com.purchasingpower.codegraph.service.sync.ChangeDetectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeDetectionServiceImpl implements ChangeDetectionService {

    private final SourceFileRepository fileRepository;
    private final FileDiscoveryService fileDiscoveryService;

    @Override
    @Transactional(readOnly = true)
    public ChangeSet detectChanges(TrackedRepository repository) {
        Path root = Path.of(repository.getPath());
        List<String> discovered;
        try {
            discovered = fileDiscoveryService.discover(root);
        } catch (IOException e) {
            throw new ChangeDetectionException(root.toString(), "Failed to discover files under " + root + ": " + e.getMessage(), e);
        }
        return detectChanges(repository, discovered);
    }

    @Override
    @Transactional(readOnly = true)
    public ChangeSet detectChanges(TrackedRepository repository, List<String> discoveredPaths) {
        Set<String> current = new LinkedHashSet<>(discoveredPaths);

        if (repository.getLastIndexed() == null) {
            log.info("No previous index for {}: all {} files are new", repository.getName(), current.size());
            return new ChangeSet(new ArrayList<>(current), List.of(), List.of());
        }

        Map<String, Long> stored = new HashMap<>();
        for (SourceFile file : fileRepository.findByRepoId(repository.getId())) {
            stored.put(file.getPath(), file.getId());
        }

        List<String> newFiles = new ArrayList<>();
        List<String> candidates = new ArrayList<>();
        for (String path : current) {
            if (stored.containsKey(path)) {
                candidates.add(path);
            } else {
                newFiles.add(path);
            }
        }

        List<Long> deletedIds = new ArrayList<>();
        stored.forEach((path, id) -> {
            if (!current.contains(path)) {
                deletedIds.add(id);
            }
        });

        List<String> changedFiles = findModifiedSince(
                Path.of(repository.getPath()), candidates, repository.getLastIndexed());

        ChangeSet changes = new ChangeSet(newFiles, changedFiles, deletedIds);
        log.info("Change detection for {}: {} new, {} changed, {} deleted (baseline {})",
                repository.getName(),
                changes.newFiles().size(),
                changes.changedFiles().size(),
                changes.deletedFileIds().size(),
                repository.getLastIndexed());
        return changes;
    }

    /**
     * Reads a file's last modification time. Overridable for file systems
     * without reliable timestamps.
     */
    protected Instant readModificationTime(Path file) throws IOException {
        return Files.getLastModifiedTime(file).toInstant();
    }

    private List<String> findModifiedSince(Path root, List<String> paths, Instant lastIndexed) {
        List<String> changed = new ArrayList<>();
        for (String path : paths) {
            Instant modified;
            try {
                modified = readModificationTime(root.resolve(path));
            } catch (NoSuchFileException e) {
                // Deleted after discovery; the next run reports it as deleted
                log.debug("File vanished during change detection: {}", path);
                continue;
            } catch (IOException e) {
                log.error("Cannot stat {}: {}", path, e.getMessage());
                throw new ChangeDetectionException(path, e);
            }
            if (modified.isAfter(lastIndexed)) {
                changed.add(path);
            }
        }
        return changed;
    }
}
