package com.graphload.core.service.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relationship name patterns and label aliases used when a relationship
 * file does not declare its endpoint labels.
 *
 * Patterns are matched in declaration order as case-insensitive substrings
 * of the relationship type.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "graphload.resolver")
public class ResolverConfig {

    private List<Pattern> patterns = new ArrayList<>(List.of(
            new Pattern("PURCHASED", "Customer", "Product"),
            new Pattern("BUY", "Customer", "Product"),
            new Pattern("ORDER", "Customer", "Product"),
            new Pattern("FOLLOWS", "User", "User"),
            new Pattern("FOLLOW", "User", "User"),
            new Pattern("IN_CATEGORY", "Product", "Category"),
            new Pattern("CATEGORY", "Product", "Category"),
            new Pattern("VIEWED", "Customer", "Product"),
            new Pattern("VIEW", "Customer", "Product"),
            new Pattern("AUTHORED", "User", "Post"),
            new Pattern("AUTHOR", "User", "Post"),
            new Pattern("COMMENTED", "User", "Comment"),
            new Pattern("COMMENT", "User", "Comment")
    ));

    /**
     * Label to substitutes tried, in order, when the label itself is not in the dataset.
     */
    private Map<String, List<String>> aliases = new LinkedHashMap<>(Map.of(
            "User", List.of("Customer")
    ));

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pattern {

        private String match;

        private String source;

        private String target;
    }
}
