package com.graphload.core.service.resolve;

import com.graphload.core.service.config.ResolverConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RelationshipPatternTableTest {

    private final RelationshipPatternTable table = new RelationshipPatternTable(new ResolverConfig());

    @Test
    @DisplayName("Should match type names by case-insensitive substring")
    void shouldMatchSubstring() {
        var pair = table.match("has_purchased_item", List.of("Customer", "Product"));

        assertThat(pair).contains(new LabelPair("Customer", "Product"));
    }

    @Test
    @DisplayName("Should skip patterns whose labels are not in the dataset")
    void shouldRequireBothLabels() {
        assertThat(table.match("PURCHASED", List.of("Customer"))).isEmpty();
        assertThat(table.match("IN_CATEGORY", List.of("Product", "Category"))).contains(
                new LabelPair("Product", "Category"));
    }

    @Test
    @DisplayName("Should substitute an alias when the pattern label is missing")
    void shouldUseAliases() {
        assertThat(table.match("FOLLOWS", List.of("Customer", "Product")))
                .contains(new LabelPair("Customer", "Customer"));
    }

    @Test
    @DisplayName("Should try patterns in configured order")
    void shouldHonorConfiguredOrder() {
        var config = new ResolverConfig();
        config.setPatterns(List.of(
                new ResolverConfig.Pattern("WORKS", "Person", "Company"),
                new ResolverConfig.Pattern("WORKS_AT", "Employee", "Office")));
        config.setAliases(Map.of());
        var custom = new RelationshipPatternTable(config);

        assertThat(custom.match("WORKS_AT", List.of("Person", "Company", "Employee", "Office")))
                .contains(new LabelPair("Person", "Company"));
    }

    @Test
    @DisplayName("Should not match a blank type")
    void shouldIgnoreBlankType() {
        assertThat(table.match(" ", List.of("Customer", "Product"))).isEmpty();
        assertThat(table.match(null, List.of("Customer", "Product"))).isEmpty();
    }
}
