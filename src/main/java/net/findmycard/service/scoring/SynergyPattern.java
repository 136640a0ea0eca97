package net.findmycard.service.scoring;

/**
 * Enabler/payoff relationships: the enabler produces a resource or trigger the payoff consumes.
 * Strengths are relative; a pair's combined strength is capped at 1 by the scorer.
 */
enum SynergyPattern {
    TOKEN_GENERATOR_CONSUMER("token generator feeds token payoff", 0.35) {
        @Override
        boolean matches(CardTraits enabler, CardTraits payoff) {
            return enabler.textContains("create") && enabler.textContains("token")
                && (payoff.textContains("sacrifice") || payoff.textContains("token") && payoff.textContains("get"));
        }
    },
    MILL_GRAVEYARD("mill enabler feeds graveyard payoff", 0.30) {
        @Override
        boolean matches(CardTraits enabler, CardTraits payoff) {
            return enabler.textContains("mill") && payoff.textContains("graveyard");
        }
    },
    RAMP_EXPENSIVE_SPELL("ramp enables expensive spell", 0.25) {
        @Override
        boolean matches(CardTraits enabler, CardTraits payoff) {
            return enabler.textContains("add {") && payoff.manaValue() >= 6.0;
        }
    },
    ARTIFACT_METALCRAFT("artifact enabler feeds artifact payoff", 0.30) {
        @Override
        boolean matches(CardTraits enabler, CardTraits payoff) {
            return (enabler.hasCardType("artifact") || enabler.textContains("artifact"))
                && (payoff.textContains("metalcraft") || payoff.textContains("artifact") && payoff.textContains("control"));
        }
    },
    ETB_BOUNCE("enter trigger reused by bounce", 0.25) {
        @Override
        boolean matches(CardTraits enabler, CardTraits payoff) {
            return (enabler.textContains("enters the battlefield") || enabler.textContains("when ~ enters"))
                && payoff.textContains("return") && payoff.textContains("hand");
        }
    },
    DRAW_HAND_SIZE("card draw feeds hand size payoff", 0.20) {
        @Override
        boolean matches(CardTraits enabler, CardTraits payoff) {
            return enabler.roles().contains(FunctionalRole.CARD_DRAW)
                && (payoff.textContains("hand size") || payoff.textContains("cards in hand")
                    || payoff.textContains("cards in your hand"));
        }
    },
    EQUIPMENT_CREATURE("equipment suits creature", 0.30) {
        @Override
        boolean matches(CardTraits enabler, CardTraits payoff) {
            return enabler.hasSubtype("equipment") && payoff.hasCardType("creature")
                && (payoff.textContains("equipped") || payoff.textContains("hexproof")
                    || payoff.textContains("protection"));
        }
    },
    UNTAP_COMBO("untap combo", 0.40) {
        @Override
        boolean matches(CardTraits enabler, CardTraits payoff) {
            boolean untapsTapAbility = enabler.textContains("untap target") && payoff.textContains("{t}:");
            boolean untapsManaSource = enabler.textContains("untap") && payoff.textContains("{t}: add");
            return untapsTapAbility || untapsManaSource;
        }
    };

    private final String reason;
    private final double strength;

    SynergyPattern(String reason, double strength) {
        this.reason = reason;
        this.strength = strength;
    }

    String reason() {
        return reason;
    }

    double strength() {
        return strength;
    }

    abstract boolean matches(CardTraits enabler, CardTraits payoff);
}
