package com.runeforge.rules.runtime;

import com.runeforge.rules.api.IRuleElementEngine;
import com.runeforge.rules.api.element.RuleElement;
import com.runeforge.rules.api.element.RuleElementKind;
import com.runeforge.rules.api.element.RuleElementVisitor;
import com.runeforge.rules.api.model.RuleElementContext;
import com.runeforge.rules.api.result.ProcessedRuleElements;
import com.runeforge.rules.infra.metrics.MetricsRegistry;
import com.runeforge.rules.runtime.processor.ActiveEffectLikeProcessor;
import com.runeforge.rules.runtime.processor.ActorTraitsProcessor;
import com.runeforge.rules.runtime.processor.AdjustModifierProcessor;
import com.runeforge.rules.runtime.processor.BaseSpeedProcessor;
import com.runeforge.rules.runtime.processor.ChoiceSetProcessor;
import com.runeforge.rules.runtime.processor.CreatureSizeProcessor;
import com.runeforge.rules.runtime.processor.DamageDiceProcessor;
import com.runeforge.rules.runtime.processor.ElementProcessor;
import com.runeforge.rules.runtime.processor.FastHealingProcessor;
import com.runeforge.rules.runtime.processor.FlatModifierProcessor;
import com.runeforge.rules.runtime.processor.GrantItemProcessor;
import com.runeforge.rules.runtime.processor.ImmunityProcessor;
import com.runeforge.rules.runtime.processor.ResistanceProcessor;
import com.runeforge.rules.runtime.processor.RollOptionProcessor;
import com.runeforge.rules.runtime.processor.SenseProcessor;
import com.runeforge.rules.runtime.processor.StrikingProcessor;
import com.runeforge.rules.runtime.processor.TempHpProcessor;
import com.runeforge.rules.runtime.processor.TogglePropertyProcessor;
import com.runeforge.rules.runtime.processor.WeaknessProcessor;
import com.runeforge.rules.runtime.processor.WeaponPotencyProcessor;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Routes rule elements to their processors and accumulates one {@link ProcessedRuleElements}
 * per pass.
 *
 * <h2>Pass semantics</h2>
 * <ul>
 * <li>Elements are processed in list order; results keep that order within each category.</li>
 * <li>AdjustModifier rewrites matching modifiers accumulated earlier in the same pass.
 * Modifiers produced later are never adjusted, so authoring order matters.</li>
 * <li>WeaponPotency contributes its potency and both derived modifiers.</li>
 * <li>Unrecognized kinds are logged and skipped. A processor returning {@code null}
 * contributes nothing.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Processors are stateless; every pass has its own accumulator. One registry can serve
 * concurrent passes.
 */
public class RuleElementRegistry implements IRuleElementEngine {
    private static final Logger logger = Logger.getLogger(RuleElementRegistry.class.getName());

    private final Tracer tracer;
    private final MetricsRegistry metrics;

    private final FlatModifierProcessor flatModifier = new FlatModifierProcessor();
    private final AdjustModifierProcessor adjustModifier = new AdjustModifierProcessor();
    private final DamageDiceProcessor damageDice = new DamageDiceProcessor();
    private final BaseSpeedProcessor baseSpeed = new BaseSpeedProcessor();
    private final SenseProcessor sense = new SenseProcessor();
    private final GrantItemProcessor grantItem = new GrantItemProcessor();
    private final ChoiceSetProcessor choiceSet = new ChoiceSetProcessor();
    private final ActiveEffectLikeProcessor activeEffectLike = new ActiveEffectLikeProcessor();
    private final RollOptionProcessor rollOption = new RollOptionProcessor();
    private final TogglePropertyProcessor toggleProperty = new TogglePropertyProcessor();
    private final WeaponPotencyProcessor weaponPotency = new WeaponPotencyProcessor();
    private final StrikingProcessor striking = new StrikingProcessor();
    private final TempHpProcessor tempHp = new TempHpProcessor();
    private final FastHealingProcessor fastHealing = new FastHealingProcessor();
    private final ResistanceProcessor resistance = new ResistanceProcessor();
    private final WeaknessProcessor weakness = new WeaknessProcessor();
    private final ImmunityProcessor immunity = new ImmunityProcessor();
    private final CreatureSizeProcessor creatureSize = new CreatureSizeProcessor();
    private final ActorTraitsProcessor actorTraits = new ActorTraitsProcessor();

    public RuleElementRegistry(Tracer tracer, MetricsRegistry metrics) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public RuleElementRegistry(Tracer tracer) {
        this(tracer, MetricsRegistry.getInstance());
    }

    public RuleElementRegistry() {
        this(OpenTelemetry.noop().getTracer("runeforge-evaluator"));
    }

    @Override
    public ProcessedRuleElements process(List<RuleElement> elements, RuleElementContext context) {
        Span span = tracer.spanBuilder("process-rule-elements").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("source", context.source());
            span.setAttribute("elementCount", elements.size());
            long startTime = System.nanoTime();

            Pass pass = new Pass(context);
            for (RuleElement element : elements) {
                element.accept(pass);
            }
            ProcessedRuleElements result = pass.builder.build();

            span.setAttribute("resultCount", result.size());
            span.setAttribute("skippedCount", pass.skipped);
            metrics.timer("rule_element_pass").record(Duration.ofNanos(System.nanoTime() - startTime));
            logger.fine(() -> String.format("Processed %d rule elements from '%s' into %d results",
                    elements.size(), context.source(), result.size()));
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public boolean isSupported(String key) {
        return RuleElementKind.fromKey(key).isSupported();
    }

    @Override
    public Set<String> supportedKinds() {
        Set<String> keys = new LinkedHashSet<>();
        for (RuleElementKind kind : RuleElementKind.supported()) {
            keys.add(kind.key());
        }
        return Collections.unmodifiableSet(keys);
    }

    /**
     * Accumulator and dispatch for one pass.
     */
    private final class Pass implements RuleElementVisitor<Void> {
        private final RuleElementContext context;
        private final ProcessedRuleElements.Builder builder = ProcessedRuleElements.builder();
        private int skipped;

        Pass(RuleElementContext context) {
            this.context = context;
        }

        private <E extends RuleElement, R> Void run(E element, ElementProcessor<E, R> processor, Consumer<R> sink) {
            metrics.counter("rule_elements_processed", "kind", element.key()).increment();
            R result = processor.process(element, context);
            if (result == null) {
                metrics.counter("rule_elements_inert", "kind", element.key()).increment();
            } else {
                sink.accept(result);
            }
            return null;
        }

        @Override
        public Void visitFlatModifier(RuleElement.FlatModifier element) {
            return run(element, flatModifier, builder::modifier);
        }

        @Override
        public Void visitAdjustModifier(RuleElement.AdjustModifier element) {
            metrics.counter("rule_elements_processed", "kind", element.key()).increment();
            builder.replaceModifiers(adjustModifier.adjustment(element));
            return null;
        }

        @Override
        public Void visitDamageDice(RuleElement.DamageDice element) {
            return run(element, damageDice, builder::damageDice);
        }

        @Override
        public Void visitBaseSpeed(RuleElement.BaseSpeed element) {
            return run(element, baseSpeed, builder::speed);
        }

        @Override
        public Void visitSense(RuleElement.Sense element) {
            return run(element, sense, builder::sense);
        }

        @Override
        public Void visitGrantItem(RuleElement.GrantItem element) {
            return run(element, grantItem, builder::grantedItem);
        }

        @Override
        public Void visitChoiceSet(RuleElement.ChoiceSet element) {
            return run(element, choiceSet, builder::choiceSet);
        }

        @Override
        public Void visitActiveEffectLike(RuleElement.ActiveEffectLike element) {
            return run(element, activeEffectLike, builder::propertyModification);
        }

        @Override
        public Void visitRollOption(RuleElement.RollOption element) {
            return run(element, rollOption, builder::rollOption);
        }

        @Override
        public Void visitToggleProperty(RuleElement.ToggleProperty element) {
            return run(element, toggleProperty, builder::toggleProperty);
        }

        @Override
        public Void visitWeaponPotency(RuleElement.WeaponPotency element) {
            return run(element, weaponPotency, builder::weaponPotency);
        }

        @Override
        public Void visitStriking(RuleElement.Striking element) {
            return run(element, striking, builder::striking);
        }

        @Override
        public Void visitTempHp(RuleElement.TempHp element) {
            return run(element, tempHp, builder::tempHp);
        }

        @Override
        public Void visitFastHealing(RuleElement.FastHealing element) {
            return run(element, fastHealing, builder::fastHealing);
        }

        @Override
        public Void visitResistance(RuleElement.Resistance element) {
            return run(element, resistance, builder::resistance);
        }

        @Override
        public Void visitWeakness(RuleElement.Weakness element) {
            return run(element, weakness, builder::weakness);
        }

        @Override
        public Void visitImmunity(RuleElement.Immunity element) {
            return run(element, immunity, builder::immunity);
        }

        @Override
        public Void visitCreatureSize(RuleElement.CreatureSize element) {
            return run(element, creatureSize, builder::sizeModifier);
        }

        @Override
        public Void visitActorTraits(RuleElement.ActorTraits element) {
            return run(element, actorTraits, builder::traitModification);
        }

        @Override
        public Void visitUnrecognized(RuleElement.Unrecognized element) {
            String key = element.key() == null ? "unknown" : element.key();
            logger.warning(context.source() + ": unsupported rule element type: " + key);
            metrics.counter("rule_elements_skipped", "kind", key).increment();
            skipped++;
            return null;
        }
    }
}
