package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.ChoiceStore;
import com.runeforge.rules.api.element.Choice;
import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.ChoiceSetPrompt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChoiceSetProcessorTest {

    private final ChoiceSetProcessor processor = new ChoiceSetProcessor();

    @Mock
    private ChoiceStore store;

    @Test
    @DisplayName("An unanswered choice is pending with defaults filled in")
    void pending() {
        // Given
        when(store.selection("choice-weapon-expertise")).thenReturn(List.of());
        RuleElement.ChoiceSet element = new RuleElement.ChoiceSet(null, null, null,
                List.of(Choice.of("Sword", "sword"), Choice.of("Axe", "axe")), null, null);

        // When
        ChoiceSetPrompt prompt = processor.process(element,
                new RuleElementContext("Weapon Expertise", 3, null, store));

        // Then
        assertThat(prompt.flag()).isEqualTo("choice-weapon-expertise");
        assertThat(prompt.prompt()).isEqualTo("Make a selection");
        assertThat(prompt.selectionCount()).isEqualTo(1);
        assertThat(prompt.isComplete()).isFalse();
    }

    @Test
    @DisplayName("A recorded selection is read back from the store")
    void answered() {
        when(store.selection("weaponGroup")).thenReturn(List.of("axe"));
        RuleElement.ChoiceSet element = new RuleElement.ChoiceSet("weaponGroup", "Pick a group", null,
                List.of(Choice.of("Sword", "sword"), Choice.of("Axe", "axe")), 1, null);

        ChoiceSetPrompt prompt = processor.process(element, new RuleElementContext("Fighter", 1, null, store));

        assertThat(prompt.selection()).containsExactly("axe");
        assertThat(prompt.isComplete()).isTrue();
    }

    @Test
    @DisplayName("A choice set without choices is inert")
    void empty() {
        RuleElement.ChoiceSet element = new RuleElement.ChoiceSet("flag", null, null, List.of(), null, null);

        assertThat(processor.process(element, new RuleElementContext("Broken", 1, null, store))).isNull();
        verifyNoInteractions(store);
    }
}
