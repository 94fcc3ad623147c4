package model.systems;

public enum BreakthroughOutcome {
    SUCCESS,
    DEATH,
    CRIPPLING_INJURY,
    QI_DEVIATION,
    MINOR_SETBACK;

    public boolean isFailure() { return this != SUCCESS; }
}
