package org.neuralchilli.tickflow.catalog;

import jakarta.enterprise.context.ApplicationScoped;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses a pattern catalog from YAML. Entry order in the file is the
 * catalog's match order.
 */
@ApplicationScoped
public class CatalogYamlParser {

    private final Yaml yaml = new Yaml();

    public PatternCatalog parse(String yamlContent) {
        Map<String, Object> data = yaml.load(yamlContent);
        return parseCatalogFromMap(data);
    }

    public PatternCatalog parse(InputStream inputStream) {
        Map<String, Object> data = yaml.load(inputStream);
        return parseCatalogFromMap(data);
    }

    @SuppressWarnings("unchecked")
    private PatternCatalog parseCatalogFromMap(Map<String, Object> data) {
        if (data == null) {
            throw new IllegalArgumentException("Catalog document is empty");
        }
        Object patterns = data.get("patterns");
        if (!(patterns instanceof List) || ((List<?>) patterns).isEmpty()) {
            throw new IllegalArgumentException("Catalog must list at least one pattern");
        }

        List<PatternMapping> mappings = new ArrayList<>();
        for (Map<String, Object> entry : (List<Map<String, Object>>) patterns) {
            mappings.add(parseMapping(entry));
        }
        return new PatternCatalog(mappings);
    }

    @SuppressWarnings("unchecked")
    private PatternMapping parseMapping(Map<String, Object> entry) {
        String name = getString(entry, "name", true);
        int wcp = getInt(entry, "wcp", 0);
        Trigger trigger = Trigger.fromString(getString(entry, "trigger", true));
        Verb verb = Verb.fromString(getString(entry, "verb", true));

        Map<String, Object> params = (Map<String, Object>) entry.getOrDefault("params", Map.of());
        VerbParameters parameters;
        try {
            parameters = parseParameters(verb, params);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid parameters for pattern " + name + ": " + e.getMessage(), e);
        }
        return new PatternMapping(wcp, name, trigger, parameters);
    }

    private VerbParameters parseParameters(Verb verb, Map<String, Object> params) {
        return switch (verb) {
            case TRANSMUTE -> new VerbParameters.TransmuteParameters();
            case COPY -> new VerbParameters.CopyParameters(
                    Cardinality.fromString(getString(params, "cardinality", true)));
            case FILTER -> new VerbParameters.FilterParameters(
                    SelectionMode.fromString(getString(params, "selection", true)));
            case AWAIT -> {
                String strategy = getString(params, "strategy", false);
                yield new VerbParameters.AwaitParameters(
                        Threshold.fromString(getString(params, "threshold", true)),
                        strategy != null ? CompletionStrategy.fromString(strategy) : null,
                        getBoolean(params, "reset", false));
            }
            case VOID -> new VerbParameters.VoidParameters(
                    CancellationScope.fromString(getString(params, "scope", true)));
        };
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }
}
