package org.neuralchilli.tickflow.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.neuralchilli.tickflow.catalog.CatalogYamlParser;
import org.neuralchilli.tickflow.catalog.PatternCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Produces the pattern catalog once at startup, from the configured file or
 * from the catalog bundled on the classpath.
 */
@ApplicationScoped
public class CatalogProducer {

    private static final Logger log = LoggerFactory.getLogger(CatalogProducer.class);

    static final String BUNDLED_CATALOG = "catalog/wcp43.yaml";

    @Inject
    CatalogYamlParser parser;

    @Inject
    EngineConfig config;

    @Produces
    @Singleton
    public PatternCatalog patternCatalog() {
        PatternCatalog catalog = config.catalog().location()
                .map(this::fromFile)
                .orElseGet(this::bundled);
        log.info("Pattern catalog loaded: {} entries covering {} patterns",
                catalog.size(), catalog.coveredPatterns().size());
        return catalog;
    }

    private PatternCatalog fromFile(String location) {
        Path path = Path.of(location);
        log.info("Loading pattern catalog from: {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return parser.parse(in);
        } catch (IOException e) {
            log.error("Failed to read pattern catalog: {}", path, e);
            throw new UncheckedIOException("Cannot read pattern catalog " + path, e);
        }
    }

    /**
     * The catalog shipped with the engine
     */
    public PatternCatalog bundled() {
        return loadBundled(parser);
    }

    public static PatternCatalog loadBundled(CatalogYamlParser parser) {
        try (InputStream in = CatalogProducer.class.getClassLoader().getResourceAsStream(BUNDLED_CATALOG)) {
            if (in == null) {
                throw new IllegalStateException("Bundled catalog not found on classpath: " + BUNDLED_CATALOG);
            }
            return parser.parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bundled catalog", e);
        }
    }
}
