package com.runeforge.rules.runtime.processor;

import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.model.ModifierType;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.Modifier;
import com.runeforge.rules.api.result.WeaponPotencyResult;
import com.runeforge.rules.runtime.value.ValueResolver;

import java.util.OptionalInt;

/**
 * WeaponPotency: a +1..+3 item bonus to attack rolls, mirrored onto damage. The damage
 * selector is the attack selector with {@code attack-roll} replaced by {@code damage}.
 */
public class WeaponPotencyProcessor implements ElementProcessor<RuleElement.WeaponPotency, WeaponPotencyResult> {
    static final String DEFAULT_SELECTOR = "strike-attack-roll";

    @Override
    public WeaponPotencyResult process(RuleElement.WeaponPotency element, RuleElementContext context) {
        OptionalInt value = ValueResolver.resolve(element.value(), context);
        if (value.isEmpty()) {
            return null;
        }
        int potency = clamp(value.getAsInt());
        String selector = Labels.isBlank(element.selector()) ? DEFAULT_SELECTOR : element.selector();
        String label = "+" + potency + " Weapon Potency";
        boolean alwaysActive = element.predicate().isEmpty();
        Modifier attack = new Modifier(label, context.source(), potency, ModifierType.ITEM, selector,
                element.predicate(), true, alwaysActive, null);
        Modifier damage = new Modifier(label, context.source(), potency, ModifierType.ITEM, damageSelector(selector),
                element.predicate(), true, alwaysActive, null);
        return new WeaponPotencyResult(potency, attack, damage, context.source(), element.predicate());
    }

    static int clamp(int value) {
        return Math.min(Math.max(value, 1), 3);
    }

    static String damageSelector(String selector) {
        int index = selector.indexOf("attack-roll");
        return index < 0 ? selector : selector.substring(0, index) + "damage" + selector.substring(index + "attack-roll".length());
    }
}
