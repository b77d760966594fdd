package pokeai.model;

public enum EventType {
    TURN_START,
    SWITCH,
    DRAG,
    MOVE,
    DAMAGE,
    HEAL,
    CRIT,
    MISS,
    IMMUNE,
    FAIL,
    NO_OP,
    CANT_MOVE,
    STATUS,
    CURE,
    STAT_CHANGE,
    VOLATILE_START,
    VOLATILE_END,
    PROTECT,
    HAZARD_SET,
    HAZARD_DAMAGE,
    HAZARDS_CLEARED,
    SCREEN_START,
    SCREEN_END,
    SIDE_CONDITION_START,
    SIDE_CONDITION_END,
    WEATHER,
    WEATHER_END,
    TERRAIN,
    TERRAIN_END,
    ITEM_CONSUMED,
    ABILITY,
    TERASTALLIZE,
    MEGA_EVOLVE,
    ZMOVE,
    DYNAMAX,
    DYNAMAX_END,
    FAINT,
    FORCED_SWITCH,
    WIN,
    TIE
}
