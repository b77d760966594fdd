package pokeai.data;

/**
 * What a move does besides dealing damage.
 */
public enum MoveEffectKind {
    INFLICT_STATUS,
    BOOST,
    INFLICT_VOLATILE,
    SET_HAZARD,
    REMOVE_HAZARDS,
    SET_SCREEN,
    SET_WEATHER,
    SET_TERRAIN,
    SET_SIDE_CONDITION,
    HEAL,
    PROTECT,
    /** Rest: full heal and two turns of sleep. */
    REST
}
