package pokeai.data;

public enum EffectTarget {
    SELF,
    FOE
}
