package init;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable per-session view of the options representative selection depends on.
 * A session takes one of these at construction instead of reading {@link Config} directly.
 */
public final class QuantOptions {

    private final QuantRepMode representativeMode;
    private final boolean restrictToInstantiationClosure;
    private final OptionalInt maxInstantiationLevel;
    private final boolean levelInputOnly;
    private final boolean cegqiActive;
    private final boolean finiteModelFinding;

    private QuantOptions(Builder b) {
        this.representativeMode = b.representativeMode;
        this.restrictToInstantiationClosure = b.restrictToInstantiationClosure;
        this.maxInstantiationLevel = b.maxInstantiationLevel;
        this.levelInputOnly = b.levelInputOnly;
        this.cegqiActive = b.cegqiActive;
        this.finiteModelFinding = b.finiteModelFinding;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static QuantOptions defaults() {
        return builder().build();
    }

    /**
     * Snapshot of the current static defaults in {@link Config}.
     */
    public static QuantOptions fromConfig() {
        Builder b = builder()
                .representativeMode(QuantRepMode.fromString(Config.quantRepMode))
                .restrictToInstantiationClosure(Config.lteRestrictInstClosure)
                .levelInputOnly(Config.instLevelInputOnly)
                .cegqiActive(Config.cbqi)
                .finiteModelFinding(Config.finiteModelFind);
        if (Config.instMaxLevel != -1) {
            b.maxInstantiationLevel(Config.instMaxLevel);
        }
        return b.build();
    }

    public QuantRepMode getRepresentativeMode() {
        return representativeMode;
    }

    public boolean isRestrictToInstantiationClosure() {
        return restrictToInstantiationClosure;
    }

    public OptionalInt getMaxInstantiationLevel() {
        return maxInstantiationLevel;
    }

    public boolean isLevelInputOnly() {
        return levelInputOnly;
    }

    public boolean isCegqiActive() {
        return cegqiActive;
    }

    public boolean isFiniteModelFinding() {
        return finiteModelFinding;
    }

    @Override
    public String toString() {
        return "QuantOptions{mode=" + representativeMode
                + ", restrictInstClosure=" + restrictToInstantiationClosure
                + ", maxLevel=" + (maxInstantiationLevel.isPresent() ? maxInstantiationLevel.getAsInt() : "none")
                + ", levelInputOnly=" + levelInputOnly
                + ", cegqi=" + cegqiActive
                + ", fmf=" + finiteModelFinding + '}';
    }

    public static final class Builder {
        private QuantRepMode representativeMode = QuantRepMode.FIRST;
        private boolean restrictToInstantiationClosure = false;
        private OptionalInt maxInstantiationLevel = OptionalInt.empty();
        private boolean levelInputOnly = true;
        private boolean cegqiActive = false;
        private boolean finiteModelFinding = false;

        private Builder() {
        }

        public Builder representativeMode(QuantRepMode mode) {
            this.representativeMode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder restrictToInstantiationClosure(boolean value) {
            this.restrictToInstantiationClosure = value;
            return this;
        }

        public Builder maxInstantiationLevel(int level) {
            if (level < 0) {
                throw new IllegalArgumentException("Maximum instantiation level must be non-negative: " + level);
            }
            this.maxInstantiationLevel = OptionalInt.of(level);
            return this;
        }

        public Builder noMaxInstantiationLevel() {
            this.maxInstantiationLevel = OptionalInt.empty();
            return this;
        }

        public Builder levelInputOnly(boolean value) {
            this.levelInputOnly = value;
            return this;
        }

        public Builder cegqiActive(boolean value) {
            this.cegqiActive = value;
            return this;
        }

        public Builder finiteModelFinding(boolean value) {
            this.finiteModelFinding = value;
            return this;
        }

        public QuantOptions build() {
            return new QuantOptions(this);
        }
    }
}
