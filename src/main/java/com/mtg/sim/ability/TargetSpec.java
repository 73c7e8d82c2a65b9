package com.mtg.sim.ability;

/**
 * What an effect applies to. Targeted specs need a chosen {@link Target};
 * the others are filled in from the ability's controller and source.
 */
public enum TargetSpec {
    NONE(false),
    SOURCE(false),
    CONTROLLER(false),
    EACH_OPPONENT(false),
    ANY_TARGET(true),
    TARGET_CREATURE(true),
    TARGET_PLAYER(true),
    TARGET_PERMANENT(true),
    TARGET_SPELL(true);

    private final boolean targeted;

    TargetSpec(boolean targeted) {
        this.targeted = targeted;
    }

    public boolean isTargeted() {
        return targeted;
    }

    /**
     * Whether a chosen target has the right shape for this spec, ignoring legality.
     */
    public boolean accepts(Target target) {
        return switch (this) {
            case ANY_TARGET -> target instanceof Target.PlayerTarget || target instanceof Target.PermanentTarget;
            case TARGET_CREATURE, TARGET_PERMANENT -> target instanceof Target.PermanentTarget;
            case TARGET_PLAYER -> target instanceof Target.PlayerTarget;
            case TARGET_SPELL -> target instanceof Target.SpellTarget;
            case NONE, SOURCE, CONTROLLER, EACH_OPPONENT -> false;
        };
    }
}
