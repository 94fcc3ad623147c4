package model;

/** One line of player-visible narration. */
public record LogEntry(long id, String text, LogType type, long timestamp) { }
