package com.graphload.core.service.resolve;

import com.graphload.core.service.config.ResolverConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Guesses endpoint labels from the relationship type's name.
 *
 * Patterns are tried in configured order as case-insensitive substrings of
 * the type; a pattern only applies when both of its labels, or their
 * aliases, are known in the dataset.
 */
@Slf4j
@Component
public class RelationshipPatternTable {

    private final List<ResolverConfig.Pattern> patterns;
    private final Map<String, List<String>> aliases;

    public RelationshipPatternTable(ResolverConfig config) {
        this.patterns = List.copyOf(config.getPatterns());
        this.aliases = Map.copyOf(config.getAliases());
    }

    public Optional<LabelPair> match(String relationshipType, Collection<String> knownLabels) {
        if (relationshipType == null || relationshipType.isBlank()) {
            return Optional.empty();
        }
        String type = relationshipType.toUpperCase(Locale.ROOT);

        for (var pattern : patterns) {
            if (!type.contains(pattern.getMatch().toUpperCase(Locale.ROOT))) {
                continue;
            }
            var source = available(pattern.getSource(), knownLabels);
            var target = available(pattern.getTarget(), knownLabels);
            if (source.isPresent() && target.isPresent()) {
                log.debug("Relationship type {} matched pattern {}: {} -> {}",
                        relationshipType, pattern.getMatch(), source.get(), target.get());
                return Optional.of(new LabelPair(source.get(), target.get()));
            }
        }
        return Optional.empty();
    }

    private Optional<String> available(String label, Collection<String> knownLabels) {
        if (knownLabels.contains(label)) {
            return Optional.of(label);
        }
        return aliases.getOrDefault(label, List.of()).stream()
                .filter(knownLabels::contains)
                .findFirst();
    }
}
