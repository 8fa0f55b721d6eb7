package com.purchasingpower.codegraph.service.graph.impl;

import com.purchasingpower.codegraph.model.graph.CodeSymbol;
import com.purchasingpower.codegraph.repository.CodeSymbolRepository;
import com.purchasingpower.codegraph.service.graph.SymbolHierarchyLinker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class SymbolHierarchyLinkerImpl implements SymbolHierarchyLinker {

    private final CodeSymbolRepository symbolRepository;

    @Override
    @Transactional
    public int linkFiles(Collection<Long> fileIds) {
        if (fileIds.isEmpty()) {
            return 0;
        }
        List<CodeSymbol> symbols = symbolRepository.findByFileIdInOrderByIdAsc(fileIds);
        int linked = linkHierarchy(symbols);
        log.debug("Linked {} of {} symbols to parents across {} files", linked, symbols.size(), fileIds.size());
        return linked;
    }

    @Override
    @Transactional
    public int linkHierarchy(Collection<CodeSymbol> symbols) {
        List<CodeSymbol> linked = assignParents(symbols);
        if (!linked.isEmpty()) {
            symbolRepository.saveAll(linked);
        }
        return linked.size();
    }

    @Override
    public List<CodeSymbol> assignParents(Collection<CodeSymbol> symbols) {
        Map<Long, List<CodeSymbol>> byFile = new LinkedHashMap<>();
        for (CodeSymbol symbol : symbols) {
            byFile.computeIfAbsent(symbol.getFileId(), id -> new ArrayList<>()).add(symbol);
        }

        List<CodeSymbol> linked = new ArrayList<>();
        for (List<CodeSymbol> fileSymbols : byFile.values()) {
            List<CodeSymbol> containers = fileSymbols.stream()
                    .filter(s -> s.getSymbolType().isContainer() && hasRange(s))
                    .toList();
            if (containers.isEmpty()) {
                continue;
            }

            for (CodeSymbol member : fileSymbols) {
                if (!member.getSymbolType().isMember() || member.getParentSymbolId() != null || !hasRange(member)) {
                    continue;
                }
                for (CodeSymbol container : containers) {
                    if (!Objects.equals(container.getId(), member.getId()) && contains(container, member)) {
                        member.setParentSymbolId(container.getId());
                        linked.add(member);
                        break;
                    }
                }
            }
        }
        return linked;
    }

    private static boolean contains(CodeSymbol container, CodeSymbol member) {
        return member.getStartLine() >= container.getStartLine()
                && member.getEndLine() <= container.getEndLine();
    }

    private static boolean hasRange(CodeSymbol symbol) {
        return symbol.getStartLine() != null && symbol.getEndLine() != null;
    }
}
