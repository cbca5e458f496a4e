package com.runeforge.rules.runtime.aggregate;

import com.runeforge.rules.api.model.ModificationPhase;
import com.runeforge.rules.api.model.PropertyMode;
import com.runeforge.rules.api.result.PropertyModification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PropertyModificationsTest {

    private static PropertyModification modification(String path, PropertyMode mode, double value,
                                                     ModificationPhase phase, int priority) {
        return new PropertyModification("test", path, mode, value, phase, priority, null, true);
    }

    @Test
    @DisplayName("Sorting is by phase, then priority")
    void sort() {
        PropertyModification late = modification("a", PropertyMode.ADD, 1, ModificationPhase.AFTER_DERIVED, 10);
        PropertyModification lowPriority = modification("b", PropertyMode.ADD, 1, ModificationPhase.APPLY_AES, 50);
        PropertyModification highPriority = modification("c", PropertyMode.ADD, 1, ModificationPhase.APPLY_AES, 10);

        assertThat(PropertyModifications.sort(List.of(late, lowPriority, highPriority)))
                .containsExactly(highPriority, lowPriority, late);
    }

    @Test
    @DisplayName("Modifications create missing objects and apply in order")
    @SuppressWarnings("unchecked")
    void apply() {
        // Given
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("system", new LinkedHashMap<>(Map.of("hp", 20)));

        // When
        int applied = PropertyModifications.apply(properties, List.of(
                modification("system.hp", PropertyMode.MULTIPLY, 2, ModificationPhase.AFTER_DERIVED, 100),
                modification("system.hp", PropertyMode.ADD, 5, ModificationPhase.APPLY_AES, 100),
                modification("system.skills.athletics.rank", PropertyMode.UPGRADE, 2, ModificationPhase.APPLY_AES, 100)));

        // Then
        Map<String, Object> system = (Map<String, Object>) properties.get("system");
        Map<String, Object> skills = (Map<String, Object>) system.get("skills");
        assertThat(applied).isEqualTo(3);
        assertThat(system.get("hp")).isEqualTo(50);
        assertThat(((Map<String, Object>) skills.get("athletics")).get("rank")).isEqualTo(2);
    }

    @Test
    @DisplayName("Fractional multipliers halve a value instead of zeroing it")
    @SuppressWarnings("unchecked")
    void fractionalMultiply() {
        // Given
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("system", new LinkedHashMap<>(Map.of("speed", 30, "reach", 25)));

        // When
        PropertyModifications.apply(properties, List.of(
                modification("system.speed", PropertyMode.MULTIPLY, 0.5, ModificationPhase.APPLY_AES, 100),
                modification("system.reach", PropertyMode.MULTIPLY, 0.5, ModificationPhase.APPLY_AES, 100)));

        // Then
        Map<String, Object> system = (Map<String, Object>) properties.get("system");
        assertThat(system.get("speed")).isEqualTo(15);
        assertThat(system.get("reach")).isEqualTo(12.5);
    }

    @Test
    @DisplayName("Non-numeric leaves are only replaced by overrides")
    void nonNumericLeaf() {
        Map<String, Object> properties = new LinkedHashMap<>(Map.of("size", "med"));

        int applied = PropertyModifications.apply(properties, List.of(
                modification("size", PropertyMode.ADD, 1, ModificationPhase.APPLY_AES, 100),
                modification("size.steps", PropertyMode.ADD, 1, ModificationPhase.APPLY_AES, 100)));

        assertThat(applied).isZero();
        assertThat(properties).containsEntry("size", "med");

        PropertyModifications.apply(properties, List.of(
                modification("size", PropertyMode.OVERRIDE, 3, ModificationPhase.APPLY_AES, 100)));
        assertThat(properties).containsEntry("size", 3);
    }

    @Test
    @DisplayName("Disabled modifications are not applied")
    void disabled() {
        Map<String, Object> properties = new LinkedHashMap<>();

        PropertyModifications.apply(properties, List.of(
                modification("speed", PropertyMode.ADD, 5, ModificationPhase.APPLY_AES, 100).withEnabled(false)));

        assertThat(properties).isEmpty();
    }
}
