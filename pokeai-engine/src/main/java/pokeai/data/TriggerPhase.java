package pokeai.data;

/**
 * Moments at which an ability or item effect is consulted.
 */
public enum TriggerPhase {
    /** Holder enters the field. */
    SWITCH_IN,
    /** Holder leaves the field voluntarily. */
    SWITCH_OUT,
    /** Attacker's move base power. */
    BASE_POWER,
    /** Attacker's ATK or SPA (see {@link Effect#getStat()}). */
    ATTACK_STAT,
    /** Defender's DEF or SPD. */
    DEFENSE_STAT,
    /** Holder's Speed. */
    SPEED_STAT,
    /** Accuracy of the holder's moves. */
    ACCURACY,
    /** Same-type bonus; the effect value replaces the usual 1.5. */
    STAB,
    /** Final damage modifier applied by the attacker. */
    FINAL_DAMAGE,
    /** Final damage modifier applied by the defender. */
    DAMAGE_TAKEN,
    /** Defender ignores the move entirely. */
    IMMUNITY,
    /** Defender punishes a contact move. */
    CONTACT,
    /** Attacker pays a cost after hitting. */
    AFTER_ATTACK,
    /** Residual step at the end of each turn. */
    END_OF_TURN,
    /** Move priority adjustment. */
    PRIORITY,
    /** Always-on capabilities. */
    PASSIVE,
    /** Lengthens weather, terrain or screens set by the holder. */
    DURATION
}
