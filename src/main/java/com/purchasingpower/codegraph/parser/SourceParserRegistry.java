package com.purchasingpower.codegraph.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Holds every {@link SourceParser} bean in registration order.
 */
@Slf4j
@Component
public class SourceParserRegistry {

    private final List<SourceParser> parsers;

    public SourceParserRegistry(ObjectProvider<SourceParser> parsers) {
        this.parsers = parsers.orderedStream().collect(Collectors.toList());
        log.info("Registered {} source parser(s): {}", this.parsers.size(),
                this.parsers.stream().map(p -> p.getClass().getSimpleName()).collect(Collectors.toList()));
    }

    public Optional<SourceParser> findParser(String relativePath) {
        return parsers.stream()
                .filter(parser -> parser.supports(relativePath))
                .findFirst();
    }
}
