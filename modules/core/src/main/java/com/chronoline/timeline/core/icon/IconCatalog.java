package com.chronoline.timeline.core.icon;

import com.chronoline.timeline.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Placeholder images per category, loaded once from a directory of
 * {@code <category>.svg} files and read-only afterwards.
 * <p>
 * A missing directory leaves the catalog empty. A configured default category
 * that has no placeholder fails startup.
 */
@ApplicationScoped
@Startup
public class IconCatalog extends AbstractManagedService {

    static final String ICON_SUFFIX = ".svg";

    @ConfigProperty(name = "timeline.icons.directory", defaultValue = "icons")
    String directory;

    @ConfigProperty(name = "timeline.icons.url-prefix", defaultValue = "/images/categories/")
    String urlPrefix;

    @ConfigProperty(name = "timeline.icons.default-category")
    Optional<String> defaultCategory;

    private volatile Map<String, String> placeholders = Map.of();

    @Override
    public String serviceId() {
        return "icon-catalog";
    }

    @Override
    protected void doStart() {
        placeholders = scan(Path.of(directory), urlPrefix);
        defaultCategory.filter(c -> !c.isBlank()).ifPresent(category -> {
            if (!placeholders.containsKey(category)) {
                throw new IconCatalogException("Default icon category '" + category
                        + "' has no placeholder in " + directory);
            }
        });
        log.infof("Icon catalog loaded: %d placeholders from %s", placeholders.size(), directory);
    }

    @Override
    protected void doStop() {
        placeholders = Map.of();
    }

    /** Placeholder URL for an exact category id. */
    public Optional<String> placeholderFor(String category) {
        return Optional.ofNullable(placeholders.get(category));
    }

    public Optional<String> defaultCategory() {
        return defaultCategory.filter(c -> !c.isBlank());
    }

    public int size() {
        return placeholders.size();
    }

    public Map<String, String> placeholders() {
        return placeholders;
    }

    private Map<String, String> scan(Path directory, String urlPrefix) {
        if (!Files.isDirectory(directory)) {
            log.warnf("Icon directory %s not found; no placeholders available", directory.toAbsolutePath());
            return Map.of();
        }
        Map<String, String> found = new TreeMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + ICON_SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String category = name.substring(0, name.length() - ICON_SUFFIX.length());
                if (!category.isEmpty()) {
                    found.put(category, urlPrefix + name);
                }
            }
        } catch (IOException e) {
            throw new IconCatalogException("Failed to read icon directory " + directory, e);
        }
        return Collections.unmodifiableMap(found);
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("Icon catalog failed to start", e);
        }
    }
}
