package com.errlens.core.router;

import com.errlens.core.config.EngineConfig.ExtractorsConfig;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.extractor.StubExtractor;
import com.errlens.core.extractor.impl.generic.GenericExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExtractorRegistry}.
 */
class ExtractorRegistryTest {

    @Test
    void of_sortsByDescendingPriorityThenName() {
        List<ExtractorPlugin> plugins = List.of(
            new StubExtractor("mocha", 80, 80),
            new StubExtractor("vitest", 100, 90),
            new StubExtractor("junit", 100, 85),
            new StubExtractor("tap", 78, 70)
        );

        ExtractorRegistry registry = ExtractorRegistry.of(plugins, ExtractorsConfig.defaults());

        assertThat(names(registry.extractors()))
            .containsExactly("junit", "vitest", "mocha", "tap", "generic");
    }

    @Test
    void of_withoutGeneric_addsFallbackLast() {
        ExtractorRegistry registry = ExtractorRegistry.of(
            List.of(new StubExtractor("low", 1, 70)), ExtractorsConfig.defaults());

        assertThat(registry.fallback()).isInstanceOf(GenericExtractor.class);
        assertThat(names(registry.extractors())).containsExactly("low", "generic");
        assertThat(names(registry.candidates())).containsExactly("low");
    }

    @Test
    void of_keepsGenericLastWhateverItsPriority() {
        ExtractorRegistry registry = ExtractorRegistry.of(
            List.of(new GenericExtractor(), new StubExtractor("tiny", 5, 70)), ExtractorsConfig.defaults());

        assertThat(names(registry.extractors())).containsExactly("tiny", "generic");
    }

    @Test
    void of_removesDisabledNamesButNeverGeneric() {
        List<ExtractorPlugin> plugins = List.of(
            new StubExtractor("tap", 78, 70),
            new StubExtractor("ava", 82, 70),
            new GenericExtractor()
        );

        ExtractorRegistry registry = ExtractorRegistry.of(plugins, new ExtractorsConfig(List.of("tap", "generic")));

        assertThat(names(registry.extractors())).containsExactly("ava", "generic");
        assertThat(registry.find("tap")).isEmpty();
    }

    @Test
    void of_ignoresDuplicateNames() {
        StubExtractor first = new StubExtractor("jest", 90, 90);
        StubExtractor second = new StubExtractor("jest", 99, 90);

        ExtractorRegistry registry = ExtractorRegistry.of(List.of(first, second), ExtractorsConfig.defaults());

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.find("jest")).containsSame(first);
    }

    @Test
    void builtIn_ordersEveryBuiltInExtractor() {
        ExtractorRegistry registry = ExtractorRegistry.builtIn();

        assertThat(names(registry.extractors())).containsExactly(
            "junit", "vitest", "playwright", "typescript", "pytest", "jest", "eslint", "jasmine",
            "ava", "mocha", "tap", "maven-surefire", "maven-compiler", "maven-checkstyle", "generic");
    }

    private static List<String> names(List<ExtractorPlugin> plugins) {
        return plugins.stream().map(p -> p.getMetadata().name()).toList();
    }
}
