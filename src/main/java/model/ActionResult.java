package model;

/**
 * Outcome of a player-initiated engine operation. A failed result never mutated the state.
 * {@code outcome} names what an accepted roll produced; null for plain operations.
 */
public record ActionResult(boolean ok, String message, String outcome) {
    public static ActionResult ok(String message)                 { return new ActionResult(true, message, null); }
    public static ActionResult ok(String message, String outcome) { return new ActionResult(true, message, outcome); }
    public static ActionResult fail(String message)               { return new ActionResult(false, message, null); }
}
