package pokeai.model;

public enum BattlePhase {
    PREPARATION,
    TEAM_PREVIEW,
    BATTLE,
    FINISHED
}
