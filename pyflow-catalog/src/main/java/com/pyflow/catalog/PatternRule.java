package com.pyflow.catalog;

import com.pyflow.model.RecipeType;
import com.pyflow.model.prepare.ProcessorType;
import com.pyflow.model.transform.TransformationKind;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * What one callee means on one call target when its arguments satisfy {@link #guard()}.
 * Built with {@link #on(String, CallTarget)}.
 */
public record PatternRule(String name,
                          CallTarget target,
                          Predicate<ArgumentShape> guard,
                          TransformationKind kind,
                          RecipeType recipe,
                          ProcessorType processor,
                          ParameterExtractor extractor,
                          RuleEffect effect,
                          boolean requiresCodeRecipe,
                          boolean fallback) {

    public PatternRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        guard = guard != null ? guard : ArgumentShape.any();
        kind = kind != null ? kind : TransformationKind.UNKNOWN;
        extractor = extractor != null ? extractor : ParameterExtractor.NONE;
        effect = effect != null ? effect : RuleEffect.EMIT;
    }

    public static Builder on(String name, CallTarget target) {
        return new Builder(name, target);
    }

    /** Rule returned for callees the catalog does not know: opaque code recipe. */
    public static PatternRule opaque(String name, CallTarget target) {
        return new PatternRule(name, target, ArgumentShape.any(), TransformationKind.CUSTOM_FUNCTION,
                RecipeType.PYTHON, null, ParameterExtractor.NONE, RuleEffect.EMIT, true, true);
    }

    public boolean matches(ArgumentShape shape) {
        return guard.test(shape != null ? shape : ArgumentShape.EMPTY);
    }

    public boolean displayOnly() {
        return effect == RuleEffect.DISPLAY;
    }

    public Builder toBuilder() {
        Builder b = new Builder(name, target);
        b.guard = guard;
        b.kind = kind;
        b.recipe = recipe;
        b.processor = processor;
        b.extractor = extractor;
        b.effect = effect;
        b.requiresCodeRecipe = requiresCodeRecipe;
        return b;
    }

    @Override
    public String toString() {
        return "PatternRule{" + name + " on " + target + " -> " + kind
                + (recipe != null ? "/" + recipe : "") + (processor != null ? "/" + processor : "") + "}";
    }

    public static final class Builder {
        private final String name;
        private final CallTarget target;
        private Predicate<ArgumentShape> guard;
        private TransformationKind kind;
        private RecipeType recipe;
        private ProcessorType processor;
        private ParameterExtractor extractor;
        private RuleEffect effect;
        private boolean requiresCodeRecipe;

        private Builder(String name, CallTarget target) {
            this.name = name;
            this.target = target;
        }

        public Builder when(Predicate<ArgumentShape> guard) {
            this.guard = guard;
            return this;
        }

        public Builder kind(TransformationKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder recipe(RecipeType recipe) {
            this.recipe = recipe;
            return this;
        }

        public Builder processor(ProcessorType processor) {
            this.processor = processor;
            return this;
        }

        public Builder extract(ParameterExtractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder effect(RuleEffect effect) {
            this.effect = effect;
            return this;
        }

        public Builder display() {
            this.effect = RuleEffect.DISPLAY;
            return this;
        }

        public Builder requiresCode() {
            this.requiresCodeRecipe = true;
            return this;
        }

        public PatternRule build() {
            return new PatternRule(name, target, guard, kind, recipe, processor, extractor, effect,
                    requiresCodeRecipe, false);
        }
    }
}
