package com.example.ringside.util;

import com.example.ringside.model.Attribute;
import com.example.ringside.model.AttributeGroup;
import com.example.ringside.model.BodyType;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.FoulTactics;
import com.example.ringside.model.PhysicalProfile;
import com.example.ringside.model.Stance;
import com.example.ringside.official.FoulType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads fighter definitions from YAML.
 *
 * <pre>
 * id: iron-mike
 * name: Iron Mike          # or identity: { name: ..., nickname: ... }
 * nickname: The Hammer
 * physical: { height: 178, weight: 100, reach: 180, age: 24, stance: orthodox, bodyType: muscular }
 * power:   { powerLeft: 90, knockoutPower: 95 }
 * mental:  { chin: 80, heart: 85 }
 * tactics: { dirtiness: 40, foulTendencies: { headbutt: 30, holding: 60 } }
 * </pre>
 *
 * Attribute groups are power, speed, stamina, defense, offense, technical and
 * mental. Anything left out takes its default; unknown keys are logged and skipped.
 */
public class FighterLoader {
    private static final Logger logger = LoggerFactory.getLogger(FighterLoader.class);

    private FighterLoader() {
    }

    public static Fighter loadResource(String resourcePath) throws FighterLoadException {
        try (InputStream is = FighterLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new FighterLoadException("Fighter resource not found: " + resourcePath);
            }
            return fromData(new Yaml().load(is), resourcePath);
        } catch (IOException | YAMLException e) {
            throw new FighterLoadException("Failed to read fighter " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    public static Fighter loadFile(Path path) throws FighterLoadException {
        if (!Files.isRegularFile(path)) {
            throw new FighterLoadException("Fighter file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return fromData(new Yaml().load(is), path.toString());
        } catch (IOException | YAMLException e) {
            throw new FighterLoadException("Failed to read fighter " + path + ": " + e.getMessage(), e);
        }
    }

    public static Fighter fromYaml(String yamlText) throws FighterLoadException {
        try {
            return fromData(new Yaml().load(yamlText), "<inline>");
        } catch (YAMLException e) {
            throw new FighterLoadException("Malformed fighter YAML: " + e.getMessage(), e);
        }
    }

    private static Fighter fromData(Object data, String source) throws FighterLoadException {
        if (!(data instanceof Map)) {
            throw new FighterLoadException("Fighter definition in " + source + " is not a mapping");
        }
        Map<?, ?> root = (Map<?, ?>) data;
        Map<?, ?> identity = map(root.get("identity"));

        String name = str(root.get("name"));
        if (name == null) name = str(identity.get("name"));
        if (name == null || name.isBlank()) {
            throw new FighterLoadException("Fighter in " + source + " has no name");
        }
        String nickname = str(root.get("nickname"));
        if (nickname == null) nickname = str(identity.get("nickname"));

        Map<Attribute, Integer> attributes = new EnumMap<>(Attribute.class);
        for (AttributeGroup group : AttributeGroup.values()) {
            Map<?, ?> values = map(root.get(group.getKey()));
            for (Map.Entry<?, ?> e : values.entrySet()) {
                Attribute attribute = Attribute.fromKey(group, String.valueOf(e.getKey()));
                if (attribute == null) {
                    logger.warn("[FighterLoader] Unknown {} attribute '{}' in {}", group, e.getKey(), source);
                    continue;
                }
                attributes.put(attribute, parseIntSafe(e.getValue(), attribute.getDefaultValue()));
            }
        }

        Fighter fighter = new Fighter(str(root.get("id")), name, nickname,
            physical(map(root.get("physical"))), attributes, tactics(map(root.get("tactics")), source));
        logger.debug("[FighterLoader] Loaded {} from {}", fighter.getId(), source);
        return fighter;
    }

    private static PhysicalProfile physical(Map<?, ?> m) {
        return new PhysicalProfile(
            parseDoubleSafe(m.get("height")),
            parseDoubleSafe(m.get("weight")),
            parseDoubleSafe(m.get("reach")),
            parseIntSafe(m.get("age"), 0),
            parseEnum(Stance.class, m.get("stance")),
            parseEnum(BodyType.class, m.get("bodyType")));
    }

    private static FoulTactics tactics(Map<?, ?> m, String source) {
        if (m.isEmpty()) return FoulTactics.clean();
        Map<FoulType, Integer> tendencies = new EnumMap<>(FoulType.class);
        Map<?, ?> raw = map(m.get("foulTendencies"));
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            FoulType type = FoulType.fromTendencyKey(String.valueOf(e.getKey()));
            if (type == null) {
                logger.warn("[FighterLoader] Unknown foul tendency '{}' in {}", e.getKey(), source);
                continue;
            }
            tendencies.put(type, parseIntSafe(e.getValue(), 0));
        }
        return new FoulTactics(parseIntSafe(m.get("dirtiness"), 0), tendencies);
    }

    private static Map<?, ?> map(Object o) {
        return o instanceof Map ? (Map<?, ?>) o : Map.of();
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }

    private static int parseIntSafe(Object o, int fallback) {
        if (o instanceof Number) return (int) Math.round(((Number) o).doubleValue());
        if (o == null) return fallback;
        try {
            return (int) Math.round(Double.parseDouble(o.toString().trim()));
        } catch (NumberFormatException e) {
            logger.warn("[FighterLoader] Not a number: '{}', using {}", o, fallback);
            return fallback;
        }
    }

    private static double parseDoubleSafe(Object o) {
        if (o instanceof Number) return ((Number) o).doubleValue();
        if (o == null) return 0.0;
        try {
            return Double.parseDouble(o.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("[FighterLoader] Not a number: '{}'", o);
            return 0.0;
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, Object o) {
        if (o == null) return null;
        String key = o.toString().trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        try {
            return Enum.valueOf(type, key);
        } catch (IllegalArgumentException e) {
            logger.warn("[FighterLoader] Unknown {} '{}', using default", type.getSimpleName(), o);
            return null;
        }
    }
}
