package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.ChoiceStore;
import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.element.ValueOperand;
import com.runeforge.rules.api.model.ModificationPhase;
import com.runeforge.rules.api.model.PropertyMode;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.PropertyModification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActiveEffectLikeProcessorTest {

    private final ActiveEffectLikeProcessor processor = new ActiveEffectLikeProcessor();

    @Mock
    private ChoiceStore store;

    @Test
    @DisplayName("Placeholders in the path are filled from the store")
    void resolvesPlaceholder() {
        // Given
        when(store.selection("skill")).thenReturn(List.of("athletics"));
        RuleElement.ActiveEffectLike element = new RuleElement.ActiveEffectLike(
                "system.skills.{item|flags.system.rulesSelections.skill}.rank",
                PropertyMode.UPGRADE, ValueOperand.of(1), null, null, null);

        // When
        PropertyModification modification = processor.process(element,
                new RuleElementContext("Skill Training", 1, null, store));

        // Then
        assertThat(modification.path()).isEqualTo("system.skills.athletics.rank");
        assertThat(modification.phase()).isEqualTo(ModificationPhase.APPLY_AES);
        assertThat(modification.priority()).isEqualTo(100);
    }

    @Test
    @DisplayName("An unanswered placeholder makes the element inert")
    void unresolvedPlaceholder() {
        when(store.selection("skill")).thenReturn(List.of());
        RuleElement.ActiveEffectLike element = new RuleElement.ActiveEffectLike(
                "system.skills.{item|skill}.rank", PropertyMode.UPGRADE, ValueOperand.of(1), null, null, null);

        assertThat(processor.process(element, new RuleElementContext("Skill Training", 1, null, store))).isNull();
    }

    @Test
    @DisplayName("A mode is required")
    void missingMode() {
        RuleElement.ActiveEffectLike element = new RuleElement.ActiveEffectLike(
                "system.attributes.hp.max", null, ValueOperand.of(5), null, null, null);

        assertThat(processor.process(element, RuleElementContext.of("Toughness", 1))).isNull();
    }
}
