package model.systems;

public record BreakthroughResult(boolean success, BreakthroughOutcome outcome, String message) {

    static BreakthroughResult notReady() {
        return new BreakthroughResult(false, BreakthroughOutcome.MINOR_SETBACK, "Not ready");
    }
}
