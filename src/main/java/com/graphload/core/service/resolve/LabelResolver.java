package com.graphload.core.service.resolve;

import com.graphload.core.service.config.GraphLoadConfig;
import com.graphload.core.service.config.IngestionConfig;
import com.graphload.core.service.config.MetricsConfig;
import com.graphload.core.service.csv.IdentifierCoercion;
import com.graphload.core.service.csv.TypedRow;
import com.graphload.core.service.persistence.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Determines the source and target node labels of a relationship file.
 *
 * <p>Strategies, first usable answer wins:
 * <ol>
 *   <li>labels declared in the header or on the task; fatal when unknown to the dataset</li>
 *   <li>the relationship type's name, see {@link RelationshipPatternTable}</li>
 *   <li>the dataset's only label</li>
 *   <li>looking up sampled identifiers against every known label</li>
 *   <li>a default pick among the known labels, reported as low confidence</li>
 * </ol>
 * With one side declared, the other side is resolved from step 3 on.
 */
@Slf4j
@Component
public class LabelResolver {

    private final GraphStore graphStore;
    private final RelationshipPatternTable patternTable;
    private final MetricsConfig metricsConfig;
    private final int lookupRows;
    private final int maxLookupIds;
    private final boolean lowConfidenceWarnings;

    public LabelResolver(GraphStore graphStore,
                         RelationshipPatternTable patternTable,
                         MetricsConfig metricsConfig,
                         IngestionConfig ingestionConfig,
                         GraphLoadConfig graphLoadConfig) {
        this.graphStore = graphStore;
        this.patternTable = patternTable;
        this.metricsConfig = metricsConfig;
        this.lookupRows = ingestionConfig.getSampling().getLookupRows();
        this.maxLookupIds = ingestionConfig.getSampling().getMaxLookupIds();
        this.lowConfidenceWarnings = graphLoadConfig.getFeatures().isLowConfidenceWarningsEnabled();
    }

    /**
     * @throws LabelResolutionException when a declared label is not in the dataset or the dataset has no labels
     */
    public LabelResolution resolve(LabelResolutionRequest request) {
        var known = request.knownLabels();
        String declaredSource = blankToNull(request.declaredSource());
        String declaredTarget = blankToNull(request.declaredTarget());

        requireDeclaredLabelsKnown(declaredSource, declaredTarget, known);

        if (declaredSource != null && declaredTarget != null) {
            return resolved(request, declaredSource, declaredTarget,
                    ResolutionStrategy.HEADER_DECLARED, ResolutionStrategy.HEADER_DECLARED);
        }
        if (known.isEmpty()) {
            throw LabelResolutionException.noNodeLabels();
        }

        if (declaredSource == null && declaredTarget == null) {
            var pattern = patternTable.match(request.relationshipType(), known);
            if (pattern.isPresent()) {
                return resolved(request, pattern.get().source(), pattern.get().target(),
                        ResolutionStrategy.NAME_PATTERN, ResolutionStrategy.NAME_PATTERN);
            }
        }

        if (known.size() == 1) {
            String only = known.get(0);
            return resolved(request,
                    declaredSource != null ? declaredSource : only,
                    declaredTarget != null ? declaredTarget : only,
                    declaredSource != null ? ResolutionStrategy.HEADER_DECLARED : ResolutionStrategy.SINGLE_LABEL,
                    declaredTarget != null ? ResolutionStrategy.HEADER_DECLARED : ResolutionStrategy.SINGLE_LABEL);
        }

        String source = declaredSource;
        String target = declaredTarget;
        var sourceStrategy = ResolutionStrategy.HEADER_DECLARED;
        var targetStrategy = ResolutionStrategy.HEADER_DECLARED;

        if (source == null) {
            var found = lookUp(request, request.sourceColumn(), "source");
            if (found.isPresent()) {
                source = found.get();
                sourceStrategy = ResolutionStrategy.EXISTENCE_LOOKUP;
            }
        }
        if (target == null) {
            var found = lookUp(request, request.targetColumn(), "target");
            if (found.isPresent()) {
                target = found.get();
                targetStrategy = ResolutionStrategy.EXISTENCE_LOOKUP;
            }
        }

        if (source == null) {
            source = known.get(0);
            sourceStrategy = ResolutionStrategy.DEFAULT;
            log.warn("Could not determine source label for {}, using fallback: {}", request.relationshipType(), source);
        }
        if (target == null) {
            target = defaultTarget(known, source);
            targetStrategy = ResolutionStrategy.DEFAULT;
            log.warn("Could not determine target label for {}, using fallback: {}", request.relationshipType(), target);
        }
        if (source.equals(target)) {
            log.warn("Source and target labels are both {} for {} although the dataset has labels {}",
                    source, request.relationshipType(), known);
        }
        return resolved(request, source, target, sourceStrategy, targetStrategy);
    }

    // ==================== Strategies ====================

    private void requireDeclaredLabelsKnown(String declaredSource, String declaredTarget, List<String> known) {
        var missing = new LinkedHashSet<String>();
        if (declaredSource != null && !known.contains(declaredSource)) {
            missing.add(declaredSource);
        }
        if (declaredTarget != null && !known.contains(declaredTarget)) {
            missing.add(declaredTarget);
        }
        if (!missing.isEmpty()) {
            throw LabelResolutionException.labelsNotAvailable(new ArrayList<>(missing));
        }
    }

    /**
     * Counts, per known label, how many sampled identifiers of one side exist
     * as nodes of that label. Only a strictly highest non-zero count wins.
     */
    private Optional<String> lookUp(LabelResolutionRequest request, String column, String side) {
        var ids = sampleIds(request.sampleRows(), column);
        if (ids.isEmpty()) {
            return Optional.empty();
        }

        var hits = new LinkedHashMap<String, Integer>();
        try {
            for (String label : request.knownLabels()) {
                hits.put(label, graphStore.findExistingNodeIds(label, ids, request.datasetId()).size());
            }
        } catch (RuntimeException e) {
            log.warn("Could not look up {} labels of {} in dataset {}: {}",
                    side, request.relationshipType(), request.datasetId(), e.getMessage());
            return Optional.empty();
        }

        var winner = strictMaximum(hits);
        if (winner.isPresent()) {
            log.info("Determined {} label from ID matching: {} (counts {})", side, winner.get(), hits);
        } else {
            log.warn("Could not determine {} label from sample IDs {} (counts {})", side, ids, hits);
        }
        return winner;
    }

    private List<Object> sampleIds(List<TypedRow> rows, String column) {
        if (column == null) {
            return List.of();
        }
        var ids = new LinkedHashSet<Object>();
        rows.stream()
                .limit(lookupRows)
                .map(row -> IdentifierCoercion.coerce(row.get(column)))
                .filter(id -> id != null)
                .forEach(ids::add);
        return ids.stream().limit(maxLookupIds).toList();
    }

    private static Optional<String> strictMaximum(Map<String, Integer> hits) {
        String best = null;
        int bestCount = 0;
        boolean tied = false;
        for (var entry : hits.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
                tied = false;
            } else if (entry.getValue() == bestCount && bestCount > 0) {
                tied = true;
            }
        }
        return best == null || tied ? Optional.empty() : Optional.of(best);
    }

    private static String defaultTarget(List<String> known, String source) {
        return known.stream()
                .filter(label -> !label.equals(source))
                .findFirst()
                .orElse(source);
    }

    // ==================== Result ====================

    private LabelResolution resolved(LabelResolutionRequest request, String source, String target,
                                     ResolutionStrategy sourceStrategy, ResolutionStrategy targetStrategy) {
        var warnings = new ArrayList<String>();
        boolean defaulted = sourceStrategy == ResolutionStrategy.DEFAULT
                || targetStrategy == ResolutionStrategy.DEFAULT;
        if (defaulted) {
            metricsConfig.getLabelFallbacks().increment();
            if (lowConfidenceWarnings) {
                warnings.add(("Labels for %s were assigned by default (%s -> %s). "
                        + "Declare them in the header as Label:source_id and Label:target_id to be sure.")
                        .formatted(request.relationshipType(), source, target));
            }
        }

        log.info("Resolved {} endpoints: {} ({}) -> {} ({})",
                request.relationshipType(), source, sourceStrategy, target, targetStrategy);
        return new LabelResolution(source, target, sourceStrategy, targetStrategy, warnings);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
