package common.dto;

/**
 * Reply to one {@link common.dto.cmd.PlayerCommand}. A failed result left the game untouched.
 * An accepted breakthrough roll reports its {@code outcome} (e.g. "SUCCESS", "DEATH").
 */
public record CommandResult(long seq, boolean ok, String message, String outcome) {
    public static CommandResult ok(long seq, String message)   { return new CommandResult(seq, true, message, null); }
    public static CommandResult ok(long seq, String message, String outcome) {
        return new CommandResult(seq, true, message, outcome);
    }
    public static CommandResult fail(long seq, String message) { return new CommandResult(seq, false, message, null); }
}
