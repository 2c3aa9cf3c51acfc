package com.errlens.core.router;

import com.errlens.core.config.EngineConfig;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.extractor.impl.generic.GenericExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Immutable, priority-ordered set of extractors taking part in routing.
 *
 * <p>Extractors are sorted by descending priority, ties broken by name. The
 * generic fallback is always present and always last, whatever its priority
 * and whatever the configuration says.
 */
public final class ExtractorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExtractorRegistry.class);

    private static final Comparator<ExtractorPlugin> PRIORITY_ORDER =
        Comparator.comparingInt(ExtractorPlugin::getPriority).reversed()
            .thenComparing(p -> p.getMetadata().name());

    private final List<ExtractorPlugin> ordered;
    private final ExtractorPlugin fallback;

    private ExtractorRegistry(List<ExtractorPlugin> ordered, ExtractorPlugin fallback) {
        this.ordered = List.copyOf(ordered);
        this.fallback = fallback;
    }

    /**
     * Builds a registry from the built-in extractors found through {@link ServiceLoader}.
     *
     * @return registry with every built-in extractor
     */
    public static ExtractorRegistry builtIn() {
        return of(discoverBuiltIns(), EngineConfig.ExtractorsConfig.defaults());
    }

    /**
     * Discovers built-in extractors via SPI, in registration order.
     *
     * @return discovered extractors
     */
    public static List<ExtractorPlugin> discoverBuiltIns() {
        log.debug("Discovering extractors via ServiceLoader");
        List<ExtractorPlugin> plugins = new ArrayList<>();
        ServiceLoader.load(ExtractorPlugin.class, ExtractorRegistry.class.getClassLoader()).forEach(plugins::add);
        return plugins;
    }

    /**
     * Builds a registry from the given extractors.
     *
     * <p>Later extractors with an already-registered name are ignored. Disabled names
     * are removed, except the generic fallback.
     *
     * @param plugins candidate extractors
     * @param selection disabled extractor names
     * @return registry
     */
    public static ExtractorRegistry of(Collection<? extends ExtractorPlugin> plugins, EngineConfig.ExtractorsConfig selection) {
        Map<String, ExtractorPlugin> byName = new LinkedHashMap<>();
        for (ExtractorPlugin plugin : plugins) {
            String name = plugin.getMetadata().name();
            if (byName.putIfAbsent(name, plugin) != null) {
                log.warn("Ignoring duplicate extractor name: {}", name);
            }
        }

        ExtractorPlugin fallback = byName.remove(GenericExtractor.NAME);
        if (fallback == null) {
            fallback = new GenericExtractor();
        }
        if (!selection.isEnabled(GenericExtractor.NAME)) {
            log.warn("The {} extractor cannot be disabled; it stays as the fallback", GenericExtractor.NAME);
        }

        List<ExtractorPlugin> ordered = new ArrayList<>();
        for (ExtractorPlugin plugin : byName.values()) {
            String name = plugin.getMetadata().name();
            if (selection.isEnabled(name)) {
                ordered.add(plugin);
            } else {
                log.debug("Extractor {} is disabled in configuration", name);
            }
        }
        ordered.sort(PRIORITY_ORDER);
        ordered.add(fallback);

        log.info("Registered {} extractors", ordered.size());
        if (log.isDebugEnabled()) {
            ordered.forEach(p -> log.debug("  - {} (priority {}, threshold {})",
                p.getMetadata().name(), p.getPriority(), p.getDetectionThreshold()));
        }
        return new ExtractorRegistry(ordered, fallback);
    }

    /**
     * Returns all extractors in evaluation order, the fallback last.
     *
     * @return immutable ordered list
     */
    public List<ExtractorPlugin> extractors() {
        return ordered;
    }

    /**
     * Returns the extractors evaluated before the fallback.
     *
     * @return candidates in evaluation order
     */
    public List<ExtractorPlugin> candidates() {
        return ordered.subList(0, ordered.size() - 1);
    }

    public ExtractorPlugin fallback() {
        return fallback;
    }

    /**
     * Looks up an extractor by name.
     *
     * @param name extractor name
     * @return extractor, or empty when no registered extractor has that name
     */
    public Optional<ExtractorPlugin> find(String name) {
        return ordered.stream().filter(p -> p.getMetadata().name().equals(name)).findFirst();
    }

    public int size() {
        return ordered.size();
    }
}
