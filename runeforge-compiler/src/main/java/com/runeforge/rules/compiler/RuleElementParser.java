package com.runeforge.rules.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runeforge.rules.api.IRuleElementParser;
import com.runeforge.rules.api.element.Choice;
import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.element.RuleElementKind;
import com.runeforge.rules.api.element.ValueOperand;
import com.runeforge.rules.api.model.AdjustMode;
import com.runeforge.rules.api.model.FastHealingType;
import com.runeforge.rules.api.model.ImmunityType;
import com.runeforge.rules.api.model.ModificationPhase;
import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.model.PropertyMode;
import com.runeforge.rules.api.model.RuleSource;
import com.runeforge.rules.api.model.SenseAcuity;
import com.runeforge.rules.api.model.SizeCategory;
import com.runeforge.rules.compiler.predicate.PredicateParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Reads rule elements from the upstream JSON shape: an object whose {@code key} field names the
 * kind, plus kind-specific fields.
 *
 * <p>Parsing is lenient below the top level. An unknown key yields an
 * {@link RuleElement.Unrecognized} element; a missing or mistyped field is left {@code null} so
 * the processor can apply its default or reject the element. Only unreadable JSON or a wrong
 * top-level shape raises {@link RuleParseException}.
 */
public class RuleElementParser implements IRuleElementParser {
    private static final Logger logger = Logger.getLogger(RuleElementParser.class.getName());
    private static final Pattern DECIMAL = Pattern.compile("^[+-]?\\d+(\\.\\d+)?$");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RuleElementParser() {
        this(new ObjectMapper());
    }

    public RuleElementParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RuleElement> parseElements(String json) {
        JsonNode root = readTree(json);
        if (!root.isArray()) {
            throw new RuleParseException("Expected a JSON array of rule elements, got " + root.getNodeType());
        }
        return parseElements(root);
    }

    public List<RuleElement> parseElements(JsonNode array) {
        List<RuleElement> elements = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            elements.add(parseElement(node));
        }
        return elements;
    }

    @Override
    public List<RuleSource> parseSources(String json) {
        JsonNode root = readTree(json);
        if (root.isObject()) {
            return List.of(parseSource(root, 0));
        }
        if (!root.isArray()) {
            throw new RuleParseException("Expected a JSON array of rule sources, got " + root.getNodeType());
        }
        List<RuleSource> sources = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            sources.add(parseSource(root.get(i), i));
        }
        return sources;
    }

    @Override
    public List<RuleSource> parseSources(Path path) throws IOException {
        try {
            return parseSources(Files.readString(path));
        } catch (RuleParseException e) {
            throw new RuleParseException(path + ": " + e.getMessage(), e);
        }
    }

    private RuleSource parseSource(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new RuleParseException("Source at index " + index + " is not an object");
        }
        String name = text(node, "name");
        if (name == null || name.isBlank()) {
            throw new RuleParseException("Source at index " + index + " has missing or empty name");
        }
        JsonNode rules = node.has("rules") ? node.get("rules") : node.get("elements");
        if (rules == null || rules.isNull()) {
            return new RuleSource(name, List.of());
        }
        if (!rules.isArray()) {
            throw new RuleParseException("Source '" + name + "' has non-array rules");
        }
        return new RuleSource(name, parseElements(rules));
    }

    /**
     * Parses one element. Never throws for a well-formed JSON node.
     */
    public RuleElement parseElement(JsonNode node) {
        if (!node.isObject()) {
            logger.warning("Rule element is not an object: " + node);
            return new RuleElement.Unrecognized(null, Map.of("value", node.toString()));
        }
        String key = text(node, "key");
        RuleElementKind kind = RuleElementKind.fromKey(key);
        return switch (kind) {
            case FLAT_MODIFIER -> new RuleElement.FlatModifier(
                    text(node, "selector"),
                    operand(node, "value"),
                    enumValue(node, "type", ModifierType::fromWire, key),
                    text(node, "label"),
                    bool(node, "enabled"),
                    PredicateParser.parse(node.get("predicate")));
            case ADJUST_MODIFIER -> new RuleElement.AdjustModifier(
                    text(node, "selector"),
                    text(node, "slug"),
                    enumValue(node, "mode", AdjustMode::fromWire, key),
                    number(node, "value"),
                    PredicateParser.parse(node.get("predicate")));
            case DAMAGE_DICE -> new RuleElement.DamageDice(
                    text(node, "selector"),
                    integer(node, "diceNumber"),
                    text(node, "dieSize"),
                    text(node, "damageType"),
                    text(node, "category"),
                    diceOverride(node.get("override")),
                    PredicateParser.parse(node.get("predicate")));
            case BASE_SPEED -> new RuleElement.BaseSpeed(
                    text(node, "selector"),
                    operand(node, "value"),
                    text(node, "label"),
                    PredicateParser.parse(node.get("predicate")));
            case SENSE -> new RuleElement.Sense(
                    text(node, "selector"),
                    integer(node, "range"),
                    enumValue(node, "acuity", SenseAcuity::fromWire, key),
                    text(node, "label"),
                    PredicateParser.parse(node.get("predicate")));
            case GRANT_ITEM -> new RuleElement.GrantItem(
                    text(node, "uuid"),
                    node.path("item").isObject() ? objectMapper.convertValue(node.get("item"), MAP_TYPE) : null,
                    bool(node, "allowDuplicate"),
                    integer(node, "level"),
                    PredicateParser.parse(node.get("predicate")));
            case CHOICE_SET -> new RuleElement.ChoiceSet(
                    text(node, "flag"),
                    text(node, "prompt"),
                    bool(node, "adjustName"),
                    choices(node.get("choices")),
                    integer(node, "selection"),
                    PredicateParser.parse(node.get("predicate")));
            case ACTIVE_EFFECT_LIKE -> new RuleElement.ActiveEffectLike(
                    text(node, "path"),
                    enumValue(node, "mode", PropertyMode::fromWire, key),
                    operand(node, "value"),
                    enumValue(node, "phase", ModificationPhase::fromWire, key),
                    integer(node, "priority"),
                    PredicateParser.parse(node.get("predicate")));
            case ROLL_OPTION -> new RuleElement.RollOption(
                    text(node, "option"),
                    text(node, "domain"),
                    bool(node, "toggleable"),
                    bool(node, "value"),
                    text(node, "label"),
                    bool(node, "alwaysActive"),
                    PredicateParser.parse(node.get("predicate")));
            case TOGGLE_PROPERTY -> new RuleElement.ToggleProperty(
                    text(node, "property"),
                    text(node, "label"),
                    bool(node, "value"),
                    text(node, "rollOption"),
                    text(node, "description"),
                    PredicateParser.parse(node.get("predicate")));
            case WEAPON_POTENCY -> new RuleElement.WeaponPotency(
                    operand(node, "value"),
                    text(node, "selector"),
                    PredicateParser.parse(node.get("predicate")));
            case STRIKING -> new RuleElement.Striking(
                    operand(node, "value"),
                    text(node, "selector"),
                    PredicateParser.parse(node.get("predicate")));
            case TEMP_HP -> new RuleElement.TempHp(
                    operand(node, "value"),
                    stringList(node, "events"),
                    text(node, "label"),
                    PredicateParser.parse(node.get("predicate")));
            case FAST_HEALING -> new RuleElement.FastHealing(
                    operand(node, "value"),
                    enumValue(node, "type", FastHealingType::fromWire, key),
                    stringList(node, "deactivatedBy"),
                    text(node, "label"),
                    PredicateParser.parse(node.get("predicate")));
            case RESISTANCE -> new RuleElement.Resistance(
                    stringList(node, "type"),
                    operand(node, "value"),
                    stringList(node, "exceptions"),
                    text(node, "label"),
                    PredicateParser.parse(node.get("predicate")));
            case WEAKNESS -> new RuleElement.Weakness(
                    stringList(node, "type"),
                    operand(node, "value"),
                    text(node, "label"),
                    PredicateParser.parse(node.get("predicate")));
            case IMMUNITY -> new RuleElement.Immunity(
                    enumValue(node, "type", ImmunityType::fromWire, key),
                    stringList(node, "value"),
                    text(node, "label"),
                    PredicateParser.parse(node.get("predicate")));
            case CREATURE_SIZE -> new RuleElement.CreatureSize(
                    enumValue(node, "value", SizeCategory::fromWire, key),
                    integer(node, "resizeBy"),
                    enumValue(node, "maximumSize", SizeCategory::fromWire, key),
                    enumValue(node, "minimumSize", SizeCategory::fromWire, key),
                    PredicateParser.parse(node.get("predicate")));
            case ACTOR_TRAITS -> new RuleElement.ActorTraits(
                    stringList(node, "add"),
                    stringList(node, "remove"),
                    PredicateParser.parse(node.get("predicate")));
            case UNRECOGNIZED -> {
                logger.fine("Unrecognized rule element key: " + key);
                yield new RuleElement.Unrecognized(key, objectMapper.convertValue(node, MAP_TYPE));
            }
        };
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new RuleParseException("Rule content is empty");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuleParseException("Malformed rule JSON: " + e.getOriginalMessage(), e);
        }
    }

    private List<Choice> choices(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<Choice> choices = new ArrayList<>(node.size());
        for (JsonNode choice : node) {
            if (choice.isObject()) {
                String value = text(choice, "value");
                String label = text(choice, "label");
                choices.add(new Choice(label != null ? label : value, value,
                        PredicateParser.parse(choice.get("predicate")), text(choice, "img")));
            } else if (choice.isValueNode() && !choice.isNull()) {
                choices.add(Choice.of(choice.asText(), choice.asText()));
            }
        }
        return choices;
    }

    private static RuleElement.DiceOverride diceOverride(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return new RuleElement.DiceOverride(integer(node, "diceNumber"), text(node, "dieSize"));
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    static Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return (int) Math.floor(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                logger.warning("Field '" + field + "' is not an integer: " + value.asText());
            }
        }
        return null;
    }

    static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (DECIMAL.matcher(text).matches()) {
                return Double.parseDouble(text);
            }
            logger.warning("Field '" + field + "' is not a number: " + value.asText());
        }
        return null;
    }

    static Boolean bool(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual() && ("true".equalsIgnoreCase(value.asText()) || "false".equalsIgnoreCase(value.asText()))) {
            return Boolean.parseBoolean(value.asText());
        }
        return null;
    }

    /**
     * Numbers become literals as authored; strings become formulas resolved later.
     */
    static ValueOperand operand(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return ValueOperand.of(value.asDouble());
        }
        if (value.isTextual()) {
            return ValueOperand.of(value.asText());
        }
        return null;
    }

    /**
     * Accepts a single string or an array of strings.
     */
    static List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            List<String> values = new ArrayList<>(value.size());
            for (JsonNode item : value) {
                if (item.isValueNode() && !item.isNull()) {
                    values.add(item.asText());
                }
            }
            return values;
        }
        return value.isValueNode() ? List.of(value.asText()) : null;
    }

    private static <E> E enumValue(JsonNode node, String field, Function<String, E> fromWire, String key) {
        String text = text(node, field);
        if (text == null) {
            return null;
        }
        E value = fromWire.apply(text);
        if (value == null) {
            logger.warning(key + ": unknown " + field + " '" + text + "', using default");
        }
        return value;
    }
}
