package com.purchasingpower.codegraph.service.sync.impl;

import com.purchasingpower.codegraph.exception.ChangeDetectionException;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.TrackedRepository;
import com.purchasingpower.codegraph.model.sync.ChangeSet;
import com.purchasingpower.codegraph.repository.SourceFileRepository;
import com.purchasingpower.codegraph.service.discovery.FileDiscoveryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("Change Detection Service Tests")
class ChangeDetectionServiceTest {

    private static final Instant BASELINE = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path root;

    private SourceFileRepository fileRepository;
    private FileDiscoveryService discoveryService;
    private ChangeDetectionServiceImpl changeDetection;
    private TrackedRepository repository;

    @BeforeEach
    void setUp() {
        fileRepository = mock(SourceFileRepository.class);
        discoveryService = mock(FileDiscoveryService.class);
        changeDetection = new ChangeDetectionServiceImpl(fileRepository, discoveryService);
        repository = TrackedRepository.builder()
                .id(1L)
                .name("shop")
                .path(root.toString())
                .lastIndexed(BASELINE)
                .build();
    }

    @Test
    @DisplayName("Should report every file as new without a baseline")
    void detectChanges_withoutBaseline_shouldReturnAllNew() {
        // Given
        repository.setLastIndexed(null);

        // When
        ChangeSet changes = changeDetection.detectChanges(repository, List.of("a.ts", "b.ts"));

        // Then
        assertThat(changes.newFiles()).containsExactly("a.ts", "b.ts");
        assertThat(changes.changedFiles()).isEmpty();
        assertThat(changes.deletedFileIds()).isEmpty();
        verifyNoInteractions(fileRepository);
    }

    @Test
    @DisplayName("Should split disjoint new, changed and deleted sets")
    void detectChanges_shouldClassifyFiles() throws IOException {
        // Given
        write("kept.ts", BASELINE.minus(Duration.ofHours(1)));
        write("edited.ts", BASELINE.plus(Duration.ofMinutes(5)));
        write("fresh.ts", BASELINE.plus(Duration.ofMinutes(5)));
        when(fileRepository.findByRepoId(1L)).thenReturn(List.of(
                stored(10L, "kept.ts"),
                stored(11L, "edited.ts"),
                stored(12L, "removed.ts")));

        // When
        ChangeSet changes = changeDetection.detectChanges(repository, List.of("edited.ts", "fresh.ts", "kept.ts"));

        // Then
        assertThat(changes.newFiles()).containsExactly("fresh.ts");
        assertThat(changes.changedFiles()).containsExactly("edited.ts");
        assertThat(changes.deletedFileIds()).containsExactly(12L);
        assertThat(changes.requiresReanalysis()).isTrue();
    }

    @Test
    @DisplayName("Should skip a file that vanished during detection")
    void detectChanges_withVanishedFile_shouldSkipIt() {
        // Given: stored and discovered, but gone from disk
        when(fileRepository.findByRepoId(1L)).thenReturn(List.of(stored(10L, "ghost.ts")));

        // When
        ChangeSet changes = changeDetection.detectChanges(repository, List.of("ghost.ts"));

        // Then
        assertThat(changes.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should abort when a modification time cannot be read")
    void detectChanges_withUnreadableFile_shouldThrow() throws IOException {
        // Given
        write("locked.ts", BASELINE.plus(Duration.ofMinutes(1)));
        when(fileRepository.findByRepoId(1L)).thenReturn(List.of(stored(10L, "locked.ts")));
        ChangeDetectionServiceImpl failing = new ChangeDetectionServiceImpl(fileRepository, discoveryService) {
            @Override
            protected Instant readModificationTime(Path file) throws IOException {
                throw new AccessDeniedException(file.toString());
            }
        };

        // When / Then
        assertThatThrownBy(() -> failing.detectChanges(repository, List.of("locked.ts")))
                .isInstanceOf(ChangeDetectionException.class)
                .hasMessageContaining("locked.ts")
                .hasCauseInstanceOf(AccessDeniedException.class);
    }

    @Test
    @DisplayName("Should wrap discovery failures")
    void detectChanges_withDiscoveryFailure_shouldThrow() throws IOException {
        // Given
        when(discoveryService.discover(root)).thenThrow(new IOException("walk failed"));

        // When / Then
        assertThatThrownBy(() -> changeDetection.detectChanges(repository))
                .isInstanceOf(ChangeDetectionException.class)
                .hasMessageContaining("Failed to discover files")
                .hasMessageContaining("walk failed");
    }

    private void write(String relativePath, Instant modified) throws IOException {
        Path file = root.resolve(relativePath);
        Files.writeString(file, "symbol|x|FUNCTION|1|2");
        Files.setLastModifiedTime(file, FileTime.from(modified));
    }

    private static SourceFile stored(Long id, String path) {
        return SourceFile.builder().id(id).repoId(1L).path(path).build();
    }
}
