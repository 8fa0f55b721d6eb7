package com.purchasingpower.codegraph.service.sync.impl;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Striped;
import com.purchasingpower.codegraph.cache.QueryCache;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import com.purchasingpower.codegraph.model.parse.ParsedFile;
import com.purchasingpower.codegraph.model.sync.AnalysisResult;
import com.purchasingpower.codegraph.model.sync.ChangeSet;
import com.purchasingpower.codegraph.model.sync.IngestionCounts;
import com.purchasingpower.codegraph.model.sync.ResolutionResult;
import com.purchasingpower.codegraph.model.sync.SyncType;
import com.purchasingpower.codegraph.parser.SourceParser;
import com.purchasingpower.codegraph.parser.SourceParserRegistry;
import com.purchasingpower.codegraph.repository.SourceFileRepository;
import com.purchasingpower.codegraph.repository.TrackedRepositoryRepository;
import com.purchasingpower.codegraph.service.discovery.FileDiscoveryService;
import com.purchasingpower.codegraph.service.graph.GraphCleanupService;
import com.purchasingpower.codegraph.service.graph.GraphIngestionService;
import com.purchasingpower.codegraph.service.graph.QualifiedNameResolutionService;
import com.purchasingpower.codegraph.service.sync.ChangeDetectionService;
import com.purchasingpower.codegraph.service.sync.IncrementalAnalysisService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;

/**
 * Incremental code graph analysis.
 *
 * KEY DECISIONS:
 * ════════════════════════════════════════════════════════════════════════════
 *
 * 1. BASELINE IN THE ENTITY STORE:
 * - {@code repositories.last_indexed} holds the start instant of the last
 *   successful run; files modified after it count as changed
 * - A failed run leaves the baseline untouched, so the next run retries
 *
 * 2. FILE-LEVEL GRANULARITY:
 * - When a file changes, all of its symbols and edges are deleted and re-created
 * - Edges from unchanged files into the file keep their qualified name and are
 *   bound again by the resolution pass of the same run
 *
 * 3. MODIFICATION TIME FOR CHANGE DETECTION:
 * - Works on any directory, with or without version control
 *
 * ════════════════════════════════════════════════════════════════════════════
 */
@Slf4j
@Service
public class IncrementalAnalysisServiceImpl implements IncrementalAnalysisService {

    private final TrackedRepositoryRepository repositoryRepository;
    private final SourceFileRepository fileRepository;
    private final FileDiscoveryService fileDiscoveryService;
    private final ChangeDetectionService changeDetectionService;
    private final SourceParserRegistry parserRegistry;
    private final GraphIngestionService ingestionService;
    private final QualifiedNameResolutionService resolutionService;
    private final GraphCleanupService cleanupService;
    private final QueryCache queryCache;
    private final Executor parserExecutor;

    private static final int LOCK_STRIPES = 64;

    /** Runs on the same repository path share a stripe and never overlap. */
    private final Striped<Lock> repositoryLocks = Striped.lock(LOCK_STRIPES);

    public IncrementalAnalysisServiceImpl(
            TrackedRepositoryRepository repositoryRepository,
            SourceFileRepository fileRepository,
            FileDiscoveryService fileDiscoveryService,
            ChangeDetectionService changeDetectionService,
            SourceParserRegistry parserRegistry,
            GraphIngestionService ingestionService,
            QualifiedNameResolutionService resolutionService,
            GraphCleanupService cleanupService,
            QueryCache queryCache,
            @Qualifier("parserExecutor") Executor parserExecutor) {
        this.repositoryRepository = repositoryRepository;
        this.fileRepository = fileRepository;
        this.fileDiscoveryService = fileDiscoveryService;
        this.changeDetectionService = changeDetectionService;
        this.parserRegistry = parserRegistry;
        this.ingestionService = ingestionService;
        this.resolutionService = resolutionService;
        this.cleanupService = cleanupService;
        this.queryCache = queryCache;
        this.parserExecutor = parserExecutor;
    }

    @Override
    public AnalysisResult analyze(String repositoryPath, String repositoryName) {
        return runLocked(repositoryPath, repositoryName, false);
    }

    @Override
    public AnalysisResult forceFullReanalysis(String repositoryPath, String repositoryName) {
        log.warn("FORCED FULL REANALYSIS requested for {}", repositoryName);
        return runLocked(repositoryPath, repositoryName, true);
    }

    private AnalysisResult runLocked(String repositoryPath, String repositoryName, boolean force) {
        Preconditions.checkArgument(repositoryPath != null && !repositoryPath.isBlank(),
                "repositoryPath is required");
        String root = Path.of(repositoryPath).toAbsolutePath().normalize().toString();

        Lock lock = repositoryLocks.get(root);
        lock.lock();
        try {
            return run(root, repositoryName, force);
        } finally {
            lock.unlock();
        }
    }

    private AnalysisResult run(String root, String repositoryName, boolean force) {
        long startTime = System.currentTimeMillis();
        Instant runStart = Instant.now();
        String name = repositoryName != null && !repositoryName.isBlank()
                ? repositoryName
                : Path.of(root).getFileName().toString();

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("Starting code graph analysis for repository: {} ({})", name, root);
        log.info("═══════════════════════════════════════════════════════════════");

        TrackedRepository repository = null;
        try {
            repository = resolveRepository(root, name);

            if (force) {
                cleanupService.cleanupRepository(repository.getId());
                return performFullAnalysis(repository, SyncType.FORCED_FULL_REINDEX, runStart, startTime);
            }
            if (repository.getLastIndexed() == null) {
                log.info("No previous analysis found. Performing INITIAL FULL INDEX.");
                return performFullAnalysis(repository, SyncType.INITIAL_FULL_INDEX, runStart, startTime);
            }
            return performIncrementalAnalysis(repository, runStart, startTime);

        } catch (Exception e) {
            log.error("Code graph analysis failed for {}", name, e);
            return AnalysisResult.builder()
                    .syncType(SyncType.ERROR)
                    .repositoryId(repository != null ? repository.getId() : null)
                    .repositoryName(name)
                    .totalTimeMs(System.currentTimeMillis() - startTime)
                    .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }

    // ================================================================
    // FULL ANALYSIS
    // ================================================================

    private AnalysisResult performFullAnalysis(TrackedRepository repository, SyncType syncType,
                                               Instant runStart, long startTime) throws IOException {
        List<String> paths = fileDiscoveryService.discover(Path.of(repository.getPath()));
        log.info("Found {} source files", paths.size());

        // Files left over from an interrupted run are re-ingested in place
        Set<String> discovered = new HashSet<>(paths);
        List<Long> staleIds = fileRepository.findByRepoId(repository.getId()).stream()
                .filter(file -> !discovered.contains(file.getPath()))
                .map(SourceFile::getId)
                .collect(Collectors.toList());
        if (!staleIds.isEmpty()) {
            cleanupService.deleteFiles(staleIds);
        }
        Map<String, Long> existing = idsByPath(fileRepository.findByRepoId(repository.getId()));

        return ingestAndResolve(repository, syncType, paths, existing,
                paths.size(), staleIds.size(), runStart, startTime);
    }

    // ================================================================
    // INCREMENTAL ANALYSIS
    // ================================================================

    private AnalysisResult performIncrementalAnalysis(TrackedRepository repository, Instant runStart,
                                                      long startTime) {
        // 1. Detect
        ChangeSet changes = changeDetectionService.detectChanges(repository);
        log.info("Changes since {}: {} new, {} changed, {} deleted",
                repository.getLastIndexed(), changes.newFiles().size(),
                changes.changedFiles().size(), changes.deletedFileIds().size());

        // 2. Deleted files
        if (!changes.deletedFileIds().isEmpty()) {
            cleanupService.deleteFiles(changes.deletedFileIds());
        }

        // 3. Nothing to parse
        if (!changes.requiresReanalysis()) {
            repositoryRepository.updateLastIndexed(repository.getId(), runStart);
            if (!changes.deletedFileIds().isEmpty()) {
                queryCache.clear();
            }
            log.info("No new or modified source files.");
            return AnalysisResult.builder()
                    .syncType(SyncType.NO_CHANGES)
                    .repositoryId(repository.getId())
                    .repositoryName(repository.getName())
                    .filesDeleted(changes.deletedFileIds().size())
                    .ingestion(new IngestionCounts())
                    .totalTimeMs(System.currentTimeMillis() - startTime)
                    .build();
        }

        // 4. Changed files are rebuilt from scratch
        Map<String, Long> changed = changes.changedFiles().isEmpty()
                ? Map.of()
                : idsByPath(fileRepository.findByRepoIdAndPathIn(repository.getId(), changes.changedFiles()));

        List<String> toParse = new ArrayList<>(changes.newFiles());
        toParse.addAll(changes.changedFiles());
        return ingestAndResolve(repository, SyncType.INCREMENTAL, toParse, changed,
                changes.changedFiles().size(), changes.deletedFileIds().size(), runStart, startTime);
    }

    // ================================================================
    // SHARED PIPELINE
    // ================================================================

    /**
     * Parses the given paths, clears the stored data of the files being rebuilt, then
     * ingests and resolves.
     *
     * <p>A stored file that fails to parse keeps its previous graph data, and the
     * baseline is left where it was so the next run picks the file up again.
     *
     * @param rebuiltFiles stored files, by path, whose symbols and edges are replaced by this run
     */
    private AnalysisResult ingestAndResolve(TrackedRepository repository, SyncType syncType, List<String> paths,
                                            Map<String, Long> rebuiltFiles, int filesChanged, int filesDeleted,
                                            Instant runStart, long startTime) {
        Path root = Path.of(repository.getPath());

        List<Optional<ParsedFile>> parsed = parseAll(root, paths);
        List<ParsedFile> parsedFiles = new ArrayList<>();
        Set<String> failedPaths = new HashSet<>();
        for (int i = 0; i < paths.size(); i++) {
            if (parsed.get(i).isPresent()) {
                parsedFiles.add(parsed.get(i).get());
            } else {
                failedPaths.add(paths.get(i));
            }
        }

        List<Long> rebuiltIds = new ArrayList<>();
        List<String> keptStale = new ArrayList<>();
        rebuiltFiles.forEach((path, id) -> {
            if (failedPaths.contains(path)) {
                keptStale.add(path);
            } else {
                rebuiltIds.add(id);
            }
        });
        if (!rebuiltIds.isEmpty()) {
            cleanupService.cleanupFileData(rebuiltIds);
        }

        IngestionCounts counts = ingestionService.ingest(repository.getId(), parsedFiles);
        counts.addRecordsSkipped(failedPaths.size());

        ResolutionResult resolution = resolutionService.runResolutionPass(repository.getId());

        if (keptStale.isEmpty()) {
            repositoryRepository.updateLastIndexed(repository.getId(), runStart);
        } else {
            log.warn("Keeping previous graph data of {} unparseable files {}; baseline stays at {}",
                    keptStale.size(), keptStale, repository.getLastIndexed());
        }
        queryCache.clear();

        AnalysisResult result = AnalysisResult.builder()
                .syncType(syncType)
                .repositoryId(repository.getId())
                .repositoryName(repository.getName())
                .filesAnalyzed(parsedFiles.size())
                .filesChanged(filesChanged)
                .filesDeleted(filesDeleted)
                .ingestion(counts)
                .unresolvedDeduplicated(resolution.deduplicated())
                .dependenciesResolved(resolution.resolved())
                .orphansRemoved(resolution.orphansRemoved())
                .totalTimeMs(System.currentTimeMillis() - startTime)
                .build();

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("Analysis complete: {}", result.summary());
        log.info("Ingestion: {}", counts.summary());
        log.info("═══════════════════════════════════════════════════════════════");
        return result;
    }

    /**
     * Parses files on the parser pool. A file that fails to parse is logged and left out.
     */
    private List<Optional<ParsedFile>> parseAll(Path root, List<String> paths) {
        List<CompletableFuture<Optional<ParsedFile>>> futures = paths.stream()
                .map(path -> CompletableFuture.supplyAsync(() -> parseOne(root, path), parserExecutor))
                .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private Optional<ParsedFile> parseOne(Path root, String path) {
        Optional<SourceParser> parser = parserRegistry.findParser(path);
        if (parser.isEmpty()) {
            log.debug("No parser for {}; tracking file without symbols", path);
            return Optional.of(ParsedFile.empty(path, readContent(root, path)));
        }
        try {
            return Optional.of(parser.get().parse(root, path));
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping {}: parse failed ({})", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static String readContent(Path root, String path) {
        try {
            return Files.readString(root.resolve(path));
        } catch (IOException e) {
            log.debug("Could not read {} as text: {}", path, e.getMessage());
            return null;
        }
    }

    private static Map<String, Long> idsByPath(List<SourceFile> files) {
        Map<String, Long> ids = new HashMap<>();
        files.forEach(file -> ids.put(file.getPath(), file.getId()));
        return ids;
    }

    private TrackedRepository resolveRepository(String root, String name) {
        return repositoryRepository.findByPath(root)
                .orElseGet(() -> {
                    log.info("Registering new repository '{}' at {}", name, root);
                    return repositoryRepository.save(TrackedRepository.builder()
                            .name(name)
                            .path(root)
                            .build());
                });
    }
}
