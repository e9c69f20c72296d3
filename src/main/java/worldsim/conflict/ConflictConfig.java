package worldsim.conflict;

/**
 * Tuning constants for battle and war resolution.
 * <p>
 * The decisive margin and morale-break chance have no documented derivation; they are
 * kept at their historical values and exposed here so they can be tuned per world.
 */
public final class ConflictConfig {

    private final int maxRounds;
    private final double decisiveMargin;
    private final double moraleBreakChance;
    private final double moraleBreakThreshold;
    private final int brilliantThreshold;
    private final int competentThreshold;
    private final double brilliantMultiplier;
    private final double competentMultiplier;
    private final double poorMultiplier;
    private final double roundDamageFraction;
    private final double loserCasualtyRatio;
    private final double winnerCasualtyRatio;
    private final double civilianCasualtyRatio;
    private final double baseExhaustion;
    private final double casualtyExhaustionFactor;
    private final double exhaustionLimit;
    private final double momentumEndThreshold;
    private final double victoryMomentum;

    private ConflictConfig(Builder builder) {
        this.maxRounds = builder.maxRounds;
        this.decisiveMargin = builder.decisiveMargin;
        this.moraleBreakChance = builder.moraleBreakChance;
        this.moraleBreakThreshold = builder.moraleBreakThreshold;
        this.brilliantThreshold = builder.brilliantThreshold;
        this.competentThreshold = builder.competentThreshold;
        this.brilliantMultiplier = builder.brilliantMultiplier;
        this.competentMultiplier = builder.competentMultiplier;
        this.poorMultiplier = builder.poorMultiplier;
        this.roundDamageFraction = builder.roundDamageFraction;
        this.loserCasualtyRatio = builder.loserCasualtyRatio;
        this.winnerCasualtyRatio = builder.winnerCasualtyRatio;
        this.civilianCasualtyRatio = builder.civilianCasualtyRatio;
        this.baseExhaustion = builder.baseExhaustion;
        this.casualtyExhaustionFactor = builder.casualtyExhaustionFactor;
        this.exhaustionLimit = builder.exhaustionLimit;
        this.momentumEndThreshold = builder.momentumEndThreshold;
        this.victoryMomentum = builder.victoryMomentum;

        validate();
    }

    private void validate() {
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive");
        }
        if (moraleBreakChance < 0.0 || moraleBreakChance > 1.0) {
            throw new IllegalArgumentException("moraleBreakChance must be between 0.0 and 1.0");
        }
        if (decisiveMargin < 0.0) {
            throw new IllegalArgumentException("decisiveMargin cannot be negative");
        }
        if (competentThreshold > brilliantThreshold) {
            throw new IllegalArgumentException("competentThreshold must not exceed brilliantThreshold");
        }
        if (roundDamageFraction <= 0.0) {
            throw new IllegalArgumentException("roundDamageFraction must be positive");
        }
        if (exhaustionLimit <= 0.0) {
            throw new IllegalArgumentException("exhaustionLimit must be positive");
        }
        if (loserCasualtyRatio < 0.0 || loserCasualtyRatio > 1.0 || winnerCasualtyRatio < 0.0 || winnerCasualtyRatio > 1.0) {
            throw new IllegalArgumentException("casualty ratios must be between 0.0 and 1.0");
        }
        if (victoryMomentum > War.MOMENTUM_LIMIT || momentumEndThreshold > War.MOMENTUM_LIMIT) {
            throw new IllegalArgumentException("momentum thresholds cannot exceed " + War.MOMENTUM_LIMIT);
        }
    }

    public int maxRounds() {
        return maxRounds;
    }

    public double decisiveMargin() {
        return decisiveMargin;
    }

    public double moraleBreakChance() {
        return moraleBreakChance;
    }

    public double moraleBreakThreshold() {
        return moraleBreakThreshold;
    }

    public Tactics tacticsFor(int leadershipTotal) {
        if (leadershipTotal >= brilliantThreshold) {
            return Tactics.BRILLIANT;
        }
        return leadershipTotal >= competentThreshold ? Tactics.COMPETENT : Tactics.POOR;
    }

    public double multiplier(Tactics tactics) {
        return switch (tactics) {
            case BRILLIANT -> brilliantMultiplier;
            case COMPETENT -> competentMultiplier;
            case POOR -> poorMultiplier;
        };
    }

    public double roundDamageFraction() {
        return roundDamageFraction;
    }

    public double loserCasualtyRatio() {
        return loserCasualtyRatio;
    }

    public double winnerCasualtyRatio() {
        return winnerCasualtyRatio;
    }

    public double civilianCasualtyRatio() {
        return civilianCasualtyRatio;
    }

    public double baseExhaustion() {
        return baseExhaustion;
    }

    public double casualtyExhaustionFactor() {
        return casualtyExhaustionFactor;
    }

    public double exhaustionLimit() {
        return exhaustionLimit;
    }

    public double momentumEndThreshold() {
        return momentumEndThreshold;
    }

    public double victoryMomentum() {
        return victoryMomentum;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConflictConfig defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return String.format("ConflictConfig{maxRounds=%d, decisiveMargin=%.1f, moraleBreakChance=%.2f, exhaustionLimit=%.1f, momentumEndThreshold=%.1f}",
                maxRounds, decisiveMargin, moraleBreakChance, exhaustionLimit, momentumEndThreshold);
    }

    public static final class Builder {
        private int maxRounds = 10;
        private double decisiveMargin = 50.0;
        private double moraleBreakChance = 0.2;
        private double moraleBreakThreshold = 0.3;
        private int brilliantThreshold = 15;
        private int competentThreshold = 10;
        private double brilliantMultiplier = 1.5;
        private double competentMultiplier = 1.0;
        private double poorMultiplier = 0.7;
        private double roundDamageFraction = 0.1;
        private double loserCasualtyRatio = 0.4;
        private double winnerCasualtyRatio = 0.2;
        private double civilianCasualtyRatio = 0.1;
        private double baseExhaustion = 0.1;
        private double casualtyExhaustionFactor = 0.01;
        private double exhaustionLimit = 100.0;
        private double momentumEndThreshold = 80.0;
        private double victoryMomentum = 50.0;

        public Builder maxRounds(int maxRounds) {
            this.maxRounds = maxRounds;
            return this;
        }

        public Builder decisiveMargin(double decisiveMargin) {
            this.decisiveMargin = decisiveMargin;
            return this;
        }

        public Builder moraleBreakChance(double moraleBreakChance) {
            this.moraleBreakChance = moraleBreakChance;
            return this;
        }

        public Builder moraleBreakThreshold(double moraleBreakThreshold) {
            this.moraleBreakThreshold = moraleBreakThreshold;
            return this;
        }

        public Builder tacticThresholds(int brilliant, int competent) {
            this.brilliantThreshold = brilliant;
            this.competentThreshold = competent;
            return this;
        }

        public Builder tacticMultipliers(double brilliant, double competent, double poor) {
            this.brilliantMultiplier = brilliant;
            this.competentMultiplier = competent;
            this.poorMultiplier = poor;
            return this;
        }

        public Builder roundDamageFraction(double roundDamageFraction) {
            this.roundDamageFraction = roundDamageFraction;
            return this;
        }

        public Builder casualtyRatios(double loser, double winner) {
            this.loserCasualtyRatio = loser;
            this.winnerCasualtyRatio = winner;
            return this;
        }

        public Builder civilianCasualtyRatio(double civilianCasualtyRatio) {
            this.civilianCasualtyRatio = civilianCasualtyRatio;
            return this;
        }

        public Builder exhaustion(double base, double casualtyFactor) {
            this.baseExhaustion = base;
            this.casualtyExhaustionFactor = casualtyFactor;
            return this;
        }

        public Builder exhaustionLimit(double exhaustionLimit) {
            this.exhaustionLimit = exhaustionLimit;
            return this;
        }

        public Builder momentumEndThreshold(double momentumEndThreshold) {
            this.momentumEndThreshold = momentumEndThreshold;
            return this;
        }

        public Builder victoryMomentum(double victoryMomentum) {
            this.victoryMomentum = victoryMomentum;
            return this;
        }

        public ConflictConfig build() {
            return new ConflictConfig(this);
        }
    }
}
