package com.example.skirmish.spell;

import com.example.skirmish.model.CharacterClassType;
import com.example.skirmish.model.ModifiedStat;
import com.example.skirmish.model.SaveType;
import com.example.skirmish.model.TargetMode;
import com.example.skirmish.util.DiceExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of spell definitions by id, loaded from {@code /data/spells.yaml}.
 */
public class SpellCatalog {
    
    private static final Logger logger = LoggerFactory.getLogger(SpellCatalog.class);
    
    public static final String DEFAULT_RESOURCE = "/data/spells.yaml";
    
    private final Map<String, SpellDefinition> spells = new LinkedHashMap<>();
    
    public SpellCatalog(Collection<SpellDefinition> definitions) {
        for (SpellDefinition spell : definitions) {
            String key = spell.getSpellId().toLowerCase();
            if (spells.putIfAbsent(key, spell) != null) {
                throw new CatalogException("Duplicate spell id: " + spell.getSpellId());
            }
        }
    }
    
    /** Load the catalog bundled on the classpath. */
    public static SpellCatalog loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }
    
    public static SpellCatalog fromResource(String resourcePath) {
        SpellCatalog catalog = fromEntries(CatalogYaml.loadEntries(resourcePath, "spells"), resourcePath);
        logger.info("[SpellCatalog] Loaded {} spells from {}", catalog.size(), resourcePath);
        return catalog;
    }
    
    public static SpellCatalog fromYaml(InputStream in, String sourceName) {
        return fromEntries(CatalogYaml.readEntries(in, sourceName, "spells"), sourceName);
    }
    
    @SuppressWarnings("unchecked")
    private static SpellCatalog fromEntries(List<Map<String, Object>> entries, String sourceName) {
        List<SpellDefinition> definitions = new ArrayList<>();
        for (Map<String, Object> entry : entries) {
            String id = CatalogYaml.requireStr(entry, "id", "Spell entry in " + sourceName);
            String context = "Spell '" + id + "'";
            
            Integer level = CatalogYaml.intOrNull(entry.get("level"), context);
            TargetMode mode = CatalogYaml.enumValue(TargetMode.class, entry.get("target"), null, context);
            if (level == null || mode == null) {
                throw new CatalogException(context + " needs 'level' and 'target'");
            }
            
            List<SpellModifier> modifiers = new ArrayList<>();
            Object modifierList = entry.get("modifiers");
            if (modifierList instanceof List) {
                for (Map<String, Object> mod : (List<Map<String, Object>>) modifierList) {
                    String modId = CatalogYaml.requireStr(mod, "id", context + " modifier");
                    ModifiedStat stat = CatalogYaml.enumValue(ModifiedStat.class, mod.get("stat"), null, context);
                    Integer value = CatalogYaml.intOrNull(mod.get("value"), context);
                    if (stat == null || value == null) {
                        throw new CatalogException(context + " modifier '" + modId + "' needs 'stat' and 'value'");
                    }
                    modifiers.add(new SpellModifier(modId, stat, value,
                            CatalogYaml.intOrNull(mod.get("duration"), context)));
                }
            }
            
            Set<CharacterClassType> usableBy = EnumSet.noneOf(CharacterClassType.class);
            Object classes = entry.get("usable_by");
            if (classes instanceof List) {
                for (Object cls : (List<Object>) classes) {
                    try {
                        usableBy.add(CharacterClassType.fromKey(cls.toString()));
                    } catch (IllegalArgumentException e) {
                        throw new CatalogException(context + " has unknown class: " + cls, e);
                    }
                }
            }
            
            try {
                String damageDie = validDice(CatalogYaml.str(entry.get("damage")));
                String healDie = validDice(CatalogYaml.str(entry.get("heal")));
                definitions.add(new SpellDefinition(id,
                        CatalogYaml.str(entry.get("name")),
                        level, mode, damageDie, healDie,
                        Boolean.TRUE.equals(entry.get("auto_hit")),
                        CatalogYaml.str(entry.get("condition")),
                        CatalogYaml.intOrNull(entry.get("condition_duration"), context),
                        CatalogYaml.enumValue(SaveType.class, entry.get("save"), SaveType.NONE, context),
                        validDice(CatalogYaml.str(entry.get("group_dice"))),
                        validDice(CatalogYaml.str(entry.get("pool_dice"))),
                        modifiers, usableBy));
            } catch (IllegalArgumentException e) {
                throw new CatalogException(context + ": " + e.getMessage(), e);
            }
        }
        return new SpellCatalog(definitions);
    }
    
    private static String validDice(String expression) {
        if (expression != null) {
            DiceExpression.parse(expression);
        }
        return expression;
    }
    
    public Optional<SpellDefinition> find(String spellId) {
        if (spellId == null) return Optional.empty();
        return Optional.ofNullable(spells.get(spellId.toLowerCase()));
    }
    
    /**
     * @throws IllegalArgumentException if the id is not in the catalog
     */
    public SpellDefinition get(String spellId) {
        return find(spellId).orElseThrow(() -> new IllegalArgumentException("Unknown spell id: " + spellId));
    }
    
    public boolean contains(String spellId) {
        return find(spellId).isPresent();
    }
    
    public Collection<SpellDefinition> getAll() {
        return Collections.unmodifiableCollection(spells.values());
    }
    
    public int size() {
        return spells.size();
    }
}
