package com.example.skirmish.spell;

import com.example.skirmish.model.TargetMode;
import com.example.skirmish.util.DiceExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of combat-usable items by name, loaded from {@code /data/items.yaml}.
 * Names match case-insensitively ("flask of oil" finds "Flask of Oil").
 */
public class ItemCatalog {
    
    private static final Logger logger = LoggerFactory.getLogger(ItemCatalog.class);
    
    public static final String DEFAULT_RESOURCE = "/data/items.yaml";
    
    private final Map<String, ItemDefinition> items = new LinkedHashMap<>();
    
    public ItemCatalog(Collection<ItemDefinition> definitions) {
        for (ItemDefinition item : definitions) {
            if (items.putIfAbsent(item.name().toLowerCase(), item) != null) {
                throw new CatalogException("Duplicate item: " + item.name());
            }
        }
    }
    
    public static ItemCatalog loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }
    
    public static ItemCatalog fromResource(String resourcePath) {
        List<ItemDefinition> definitions = new ArrayList<>();
        for (Map<String, Object> entry : CatalogYaml.loadEntries(resourcePath, "items")) {
            String name = CatalogYaml.requireStr(entry, "name", "Item entry in " + resourcePath);
            String context = "Item '" + name + "'";
            try {
                String damage = CatalogYaml.str(entry.get("damage"));
                String heal = CatalogYaml.str(entry.get("heal"));
                if (damage != null) DiceExpression.parse(damage);
                if (heal != null) DiceExpression.parse(heal);
                definitions.add(new ItemDefinition(name,
                        CatalogYaml.enumValue(TargetMode.class, entry.get("target"), TargetMode.SINGLE_ENEMY, context),
                        damage, heal));
            } catch (IllegalArgumentException e) {
                throw new CatalogException(context + ": " + e.getMessage(), e);
            }
        }
        ItemCatalog catalog = new ItemCatalog(definitions);
        logger.info("[ItemCatalog] Loaded {} items from {}", catalog.size(), resourcePath);
        return catalog;
    }
    
    public Optional<ItemDefinition> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(items.get(name.toLowerCase()));
    }
    
    public Collection<ItemDefinition> getAll() {
        return Collections.unmodifiableCollection(items.values());
    }
    
    public int size() {
        return items.size();
    }
}
