package com.purchasingpower.codegraph.service.graph.impl;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import com.purchasingpower.codegraph.repository.CodeSymbolRepository;
import com.purchasingpower.codegraph.repository.FileDependencyRepository;
import com.purchasingpower.codegraph.repository.SourceFileRepository;
import com.purchasingpower.codegraph.repository.SymbolDependencyRepository;
import com.purchasingpower.codegraph.repository.TrackedRepositoryRepository;
import com.purchasingpower.codegraph.service.graph.GraphCleanupService;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class GraphCleanupServiceImpl implements GraphCleanupService {

    private static final int ID_CHUNK_SIZE = 1000;

    private final TrackedRepositoryRepository repositoryRepository;
    private final SourceFileRepository fileRepository;
    private final CodeSymbolRepository symbolRepository;
    private final SymbolDependencyRepository dependencyRepository;
    private final FileDependencyRepository fileDependencyRepository;

    @Override
    @Transactional
    public int deleteFiles(Collection<Long> fileIds) {
        validateIds(fileIds);
        if (fileIds.isEmpty()) {
            return 0;
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.DATABASE, "DeleteFiles", log);
        ctx.logRequest("Deleting files", "Files", fileIds.size());

        removeFileData(fileIds, false);
        int deleted = 0;
        for (List<Long> chunk : chunks(fileIds)) {
            deleted += fileRepository.deleteByIdIn(chunk);
        }

        ctx.logResponse("Files deleted", "Deleted", deleted);
        return deleted;
    }

    @Override
    @Transactional
    public void cleanupFileData(Collection<Long> fileIds) {
        validateIds(fileIds);
        if (fileIds.isEmpty()) {
            return;
        }
        removeFileData(fileIds, true);
    }

    @Override
    @Transactional
    public void cleanupRepository(Long repoId) {
        Preconditions.checkArgument(repoId != null && repoId > 0, "Invalid repository id: %s", repoId);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.DATABASE, "CleanupRepository", log);
        List<Long> fileIds = fileRepository.findIdsByRepoId(repoId);
        ctx.logRequest("Deleting repository graph", "Repository", repoId, "Files", fileIds.size());

        if (!fileIds.isEmpty()) {
            removeFileData(fileIds, false);
            for (List<Long> chunk : chunks(fileIds)) {
                fileRepository.deleteByIdIn(chunk);
            }
        }

        ctx.logResponse("Repository graph deleted", "Files", fileIds.size());
    }

    @Override
    @Transactional
    public boolean deleteRepositoryByName(String name) {
        Optional<TrackedRepository> repository = repositoryRepository.findFirstByNameOrderByIdAsc(name);
        if (repository.isEmpty()) {
            log.info("No repository named '{}' to delete", name);
            return false;
        }

        cleanupRepository(repository.get().getId());
        repositoryRepository.deleteById(repository.get().getId());
        log.info("Deleted repository '{}' ({})", name, repository.get().getPath());
        return true;
    }

    /**
     * @param keepIncoming unbind edges from other files instead of deleting them, for files
     *                     about to be re-ingested
     */
    private void removeFileData(Collection<Long> fileIds, boolean keepIncoming) {
        int symbolEdges = 0;
        int unbound = 0;
        int fileEdges = 0;
        int symbols = 0;
        for (List<Long> chunk : chunks(fileIds)) {
            List<Long> symbolIds = symbolRepository.findIdsByFileIdIn(chunk);
            for (List<Long> symbolChunk : Lists.partition(symbolIds, ID_CHUNK_SIZE)) {
                if (keepIncoming) {
                    unbound += dependencyRepository.unbindIncoming(symbolChunk);
                }
                symbolEdges += dependencyRepository.deleteTouchingSymbols(symbolChunk);
            }
            fileEdges += fileDependencyRepository.deleteTouchingFiles(chunk);
            symbols += symbolRepository.deleteByFileIdIn(chunk);
        }
        log.debug("Removed {} symbol edges ({} incoming unbound), {} file edges and {} symbols from {} files",
                symbolEdges, unbound, fileEdges, symbols, fileIds.size());
    }

    private static void validateIds(Collection<Long> fileIds) {
        Preconditions.checkNotNull(fileIds, "fileIds is required");
        for (Long id : fileIds) {
            if (id == null || id <= 0) {
                throw new IllegalArgumentException("Invalid file id: " + id);
            }
        }
    }

    private static List<List<Long>> chunks(Collection<Long> ids) {
        return Lists.partition(new ArrayList<>(ids), ID_CHUNK_SIZE);
    }
}
