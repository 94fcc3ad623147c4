package model.systems;

public record OfflineReport(long elapsedSeconds, double xpGained, long stonesGained) {
    public static final OfflineReport NONE = new OfflineReport(0, 0, 0);

    public boolean applied() { return elapsedSeconds > 0; }
}
