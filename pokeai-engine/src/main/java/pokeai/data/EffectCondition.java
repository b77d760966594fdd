package pokeai.data;

/**
 * Guards attached to an {@link Effect}. Arguments come from the effect's own fields
 * ({@code type}, {@code weather}, {@code terrain}, {@code threshold}).
 */
public enum EffectCondition {
    ALWAYS,
    PHYSICAL_MOVE,
    SPECIAL_MOVE,
    STATUS_MOVE,
    MOVE_TYPE,
    CONTACT_MOVE,
    SUPER_EFFECTIVE,
    BASE_POWER_AT_MOST,
    WEATHER,
    TERRAIN,
    FULL_HP,
    HP_AT_MOST,
    HAS_STATUS,
    HOLDER_TYPE,
    NOT_HOLDER_TYPE,
    FOE_TYPE,
    FOE_GROUNDED,
    SETTING_WEATHER,
    SETTING_TERRAIN,
    SETTING_SCREEN
}
