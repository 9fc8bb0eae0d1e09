package com.warp.bridge.model;

import com.warp.bridge.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelResolverTest {

    private ModelResolver resolver;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        AppProperties.MappingRule exact = new AppProperties.MappingRule();
        exact.setPattern("gpt-4o-mini");
        exact.setTarget("gpt-4o");
        exact.setMatchType("exact");
        exact.setPriority(10);
        AppProperties.MappingRule prefix = new AppProperties.MappingRule();
        prefix.setPattern("claude-3");
        prefix.setTarget("claude-4-sonnet");
        prefix.setMatchType("prefix");
        prefix.setPriority(5);
        AppProperties.MappingRule regex = new AppProperties.MappingRule();
        regex.setPattern("^gemini-.*-flash$");
        regex.setTarget("gemini-2.5-pro");
        regex.setMatchType("regex");
        properties.getModels().setMappings(List.of(regex, prefix, exact));

        resolver = new ModelResolver(properties);
        resolver.init();
    }

    @Test
    void resolve_knownModel_isUsedAsIs() {
        assertEquals("gpt-5", resolver.resolve("GPT-5").base());
    }

    @Test
    void resolve_mappingRules() {
        assertEquals("gpt-4o", resolver.resolve("gpt-4o-mini").base());
        assertEquals("claude-4-sonnet", resolver.resolve("claude-3-5-sonnet-20241022").base());
        assertEquals("gemini-2.5-pro", resolver.resolve("gemini-2.0-flash").base());
    }

    @Test
    void resolve_unknownModel_fallsBackToDefaults() {
        ModelSelection selection = resolver.resolve("some-unknown-model", "also-unknown", null);

        assertEquals("claude-4.1-opus", selection.base());
        assertEquals("o3", selection.planning());
        assertEquals("auto", selection.coding());
    }

    @Test
    void resolve_explicitPlanningAndCoding() {
        ModelSelection selection = resolver.resolve("gpt-5", "o4-mini", "gpt-4.1");

        assertEquals("o4-mini", selection.planning());
        assertEquals("gpt-4.1", selection.coding());
    }

    @Test
    void init_invalidRegexRule_isRejectedAtStartup() {
        AppProperties properties = new AppProperties();
        AppProperties.MappingRule broken = new AppProperties.MappingRule();
        broken.setPattern("gpt-(4");
        broken.setTarget("gpt-4o");
        broken.setMatchType("regex");
        properties.getModels().setMappings(List.of(broken));
        ModelResolver invalid = new ModelResolver(properties);

        IllegalStateException e = assertThrows(IllegalStateException.class, invalid::init);
        assertTrue(e.getMessage().contains("gpt-(4"));
    }

    @Test
    void listModels_returnsConfiguredModels() {
        assertTrue(resolver.listModels().contains("claude-4-sonnet"));
    }
}
