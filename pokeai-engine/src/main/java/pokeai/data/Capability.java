package pokeai.data;

/**
 * Boolean capabilities granted through {@link EffectKind#CAPABILITY}.
 */
public enum Capability {
    /** Unaware: ignores the opponent's stat stages. */
    IGNORE_FOE_BOOSTS,
    /** Heavy-Duty Boots. */
    HAZARD_IMMUNE,
    /** Infiltrator: ignores screens and substitutes. */
    BYPASS_SCREENS,
    /** Levitate, Air Balloon. */
    UNGROUNDED,
    /** Sturdy, Focus Sash: survive a hit from full HP at 1 HP. */
    SURVIVE_FROM_FULL,
    /** Choice items. */
    CHOICE_LOCK,
    /** Only direct damage hurts the holder. */
    MAGIC_GUARD,
    /** Prevents the opposing active from switching (subject to the effect condition). */
    TRAPS_FOE,
    WEATHER_DAMAGE_IMMUNE,
    /** Opponent's moves cost two PP. */
    PRESSURE,
    /** Holder of a Z-crystal of {@code type}. */
    Z_CRYSTAL,
    /** Flash Fire: boosted Fire moves once activated. */
    FLASH_FIRE,
    /** Clear Body: stat drops caused by the opponent fail. */
    BLOCK_STAT_DROPS,
    FLINCH_IMMUNE,
    CRIT_IMMUNE
}
