package com.errlens.core.plugin;

import com.errlens.core.config.EngineConfig.PluginConfig;
import com.errlens.core.extractor.ExtractorPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads third-party extractors from a directory of plugin jars.
 *
 * <p>Each {@code *.jar} gets its own class loader, parented to the engine's, and
 * is searched for {@link ExtractorPlugin} services. Every plugin found is
 * validated, then registered as is ({@link TrustLevel#FULL}) or wrapped in a
 * {@link SandboxedExtractor} ({@link TrustLevel#SANDBOX}). A bad plugin or jar
 * never aborts loading; it is reported as a {@link PluginLoadError}.
 *
 * <p>Plugin class loaders stay open for the lifetime of the JVM, since the
 * registered extractors keep using them.
 */
public final class PluginLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    private PluginLoader() {
        // Utility class
    }

    /**
     * Loads every plugin jar from the configured directory.
     *
     * @param config plugin configuration
     * @param reservedNames names already taken by built-in extractors
     * @return loaded plugins and rejected ones
     */
    public static PluginLoadResult load(PluginConfig config, Set<String> reservedNames) {
        if (config.directory() == null || config.directory().isBlank()) {
            return PluginLoadResult.empty();
        }

        Path directory = Paths.get(config.directory());
        if (!Files.isDirectory(directory)) {
            log.warn("Plugin directory not found: {}", directory.toAbsolutePath());
            return PluginLoadResult.empty();
        }

        List<Path> jars;
        try (Stream<Path> files = Files.list(directory)) {
            jars = files
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(".jar"))
                .sorted()
                .toList();
        } catch (IOException e) {
            log.warn("Cannot list plugin directory {}: {}", directory, e.getMessage());
            return new PluginLoadResult(List.of(),
                List.of(new PluginLoadError(directory.toString(), "Cannot list plugin directory: " + e.getMessage())));
        }

        log.info("Loading plugins from {} ({} jar(s), trust: {})", directory, jars.size(),
            config.trust().name().toLowerCase());

        List<ExtractorPlugin> plugins = new ArrayList<>();
        List<PluginLoadError> errors = new ArrayList<>();
        Set<String> taken = new HashSet<>(reservedNames);
        for (Path jar : jars) {
            String source = jar.getFileName().toString();
            List<ExtractorPlugin> discovered = new ArrayList<>();
            try {
                discovered.addAll(discover(jar, source, errors));
            } catch (MalformedURLException e) {
                errors.add(new PluginLoadError(source, "Invalid plugin path: " + e.getMessage()));
                continue;
            }
            if (discovered.isEmpty()) {
                errors.add(new PluginLoadError(source, "No ExtractorPlugin services declared"));
            }
            PluginLoadResult registered = register(discovered, source, config, taken);
            plugins.addAll(registered.plugins());
            errors.addAll(registered.errors());
        }

        logErrors(errors);
        log.info("Loaded {} plugin(s), rejected {}", plugins.size(), errors.size());
        return new PluginLoadResult(plugins, errors);
    }

    /**
     * Validates already-instantiated plugins and wraps them according to the trust level.
     *
     * <p>Accepted plugin names are added to {@code takenNames}, so later duplicates are rejected.
     *
     * @param candidates plugins to register
     * @param source where the plugins came from
     * @param config plugin configuration (trust level and sandbox limits)
     * @param takenNames names already registered, updated in place
     * @return accepted plugins and rejections
     */
    public static PluginLoadResult register(Iterable<? extends ExtractorPlugin> candidates, String source,
                                            PluginConfig config, Set<String> takenNames) {
        List<ExtractorPlugin> plugins = new ArrayList<>();
        List<PluginLoadError> errors = new ArrayList<>();
        for (ExtractorPlugin candidate : candidates) {
            try {
                PluginValidator.validate(candidate, source, takenNames);
                ExtractorPlugin registered = wrap(candidate, config);
                takenNames.add(registered.getMetadata().name());
                plugins.add(registered);
                log.debug("Registered plugin {} from {}", registered.getMetadata().name(), source);
            } catch (PluginValidationException e) {
                errors.add(new PluginLoadError(e.getSource(), e.getMessage()));
            } catch (RuntimeException e) {
                errors.add(new PluginLoadError(source, "Plugin failed while being wrapped: " + e.getMessage()));
            }
        }
        return new PluginLoadResult(plugins, errors);
    }

    private static ExtractorPlugin wrap(ExtractorPlugin plugin, PluginConfig config) {
        return switch (config.trust()) {
            case FULL -> plugin;
            case SANDBOX -> new SandboxedExtractor(plugin, config.timeoutMs(), config.maxInputChars());
        };
    }

    private static List<ExtractorPlugin> discover(Path jar, String source, List<PluginLoadError> errors)
            throws MalformedURLException {
        URL[] urls = {jar.toUri().toURL()};
        ClassLoader loader = URLClassLoader.newInstance(urls, ExtractorPlugin.class.getClassLoader());

        List<ExtractorPlugin> found = new ArrayList<>();
        Iterator<ExtractorPlugin> iterator = ServiceLoader.load(ExtractorPlugin.class, loader).iterator();
        while (hasNext(iterator, source, errors)) {
            try {
                ExtractorPlugin plugin = iterator.next();
                // The parent loader also sees the built-ins; keep only classes defined by this jar
                if (plugin.getClass().getClassLoader() == loader) {
                    found.add(plugin);
                }
            } catch (ServiceConfigurationError e) {
                errors.add(new PluginLoadError(source, "Cannot instantiate plugin: " + e.getMessage()));
            }
        }
        return found;
    }

    private static boolean hasNext(Iterator<ExtractorPlugin> iterator, String source, List<PluginLoadError> errors) {
        try {
            return iterator.hasNext();
        } catch (ServiceConfigurationError e) {
            errors.add(new PluginLoadError(source, "Invalid service declaration: " + e.getMessage()));
            return false;
        }
    }

    private static void logErrors(List<PluginLoadError> errors) {
        if (errors.isEmpty()) {
            return;
        }
        StringBuilder block = new StringBuilder("Rejected plugins:");
        for (PluginLoadError error : errors) {
            block.append(System.lineSeparator()).append("  - ").append(error.source()).append(": ").append(error.message());
        }
        log.warn(block.toString());
    }
}
