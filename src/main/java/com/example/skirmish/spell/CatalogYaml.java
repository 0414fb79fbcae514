package com.example.skirmish.spell;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SnakeYAML helpers shared by the catalogs.
 */
final class CatalogYaml {
    
    private CatalogYaml() {}
    
    /**
     * Load the list under {@code rootKey} from a classpath resource.
     * @throws CatalogException if the resource is missing or not the expected shape
     */
    static List<Map<String, Object>> loadEntries(String resourcePath, String rootKey) {
        try (InputStream in = CatalogYaml.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new CatalogException("Catalog resource not found: " + resourcePath);
            }
            return readEntries(in, resourcePath, rootKey);
        } catch (IOException e) {
            throw new CatalogException("Failed to read " + resourcePath, e);
        }
    }
    
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> readEntries(InputStream in, String sourceName, String rootKey) {
        Object loaded;
        try {
            loaded = new Yaml().load(in);
        } catch (RuntimeException e) {
            throw new CatalogException("Malformed YAML in " + sourceName + ": " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new CatalogException(sourceName + " must be a mapping with key '" + rootKey + "'");
        }
        Object entries = ((Map<String, Object>) loaded).get(rootKey);
        if (!(entries instanceof List)) {
            throw new CatalogException(sourceName + " has no '" + rootKey + "' list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object entry : (List<Object>) entries) {
            if (!(entry instanceof Map)) {
                throw new CatalogException(sourceName + " contains a non-mapping entry: " + entry);
            }
            result.add((Map<String, Object>) entry);
        }
        return result;
    }
    
    static String str(Object o) {
        return o == null ? null : o.toString();
    }
    
    static String requireStr(Map<String, Object> entry, String key, String context) {
        String value = str(entry.get(key));
        if (value == null || value.isBlank()) {
            throw new CatalogException(context + " is missing '" + key + "'");
        }
        return value;
    }
    
    static Integer intOrNull(Object o, String context) {
        if (o == null) return null;
        if (o instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(o.toString().trim());
        } catch (NumberFormatException e) {
            throw new CatalogException(context + " has a non-numeric value: " + o, e);
        }
    }
    
    static <E extends Enum<E>> E enumValue(Class<E> type, Object o, E defaultValue, String context) {
        if (o == null) return defaultValue;
        try {
            return Enum.valueOf(type, o.toString().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new CatalogException(context + " has unknown " + type.getSimpleName() + ": " + o, e);
        }
    }
}
