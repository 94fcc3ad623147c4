package model;

/**
 * Progress along one path. {@code currentXp} never exceeds {@code xpRequired};
 * while {@code breakthroughAvailable} holds the two are equal and no XP accrues.
 */
public class PathProgress {
    private String  pathId;
    private int     currentLevel = 1;
    private double  currentXp;
    private long    xpRequired;
    private boolean breakthroughAvailable;
    private boolean unlocked;

    public PathProgress() { }

    public static PathProgress unlockedAtStart(String pathId) {
        PathProgress p = new PathProgress();
        p.pathId = pathId;
        p.currentLevel = 1;
        p.currentXp = 0;
        p.xpRequired = Progression.xpRequired(1);
        p.unlocked = true;
        return p;
    }

    public String  getPathId()                 { return pathId; }
    public void    setPathId(String id)        { this.pathId = id; }
    public int     getCurrentLevel()           { return currentLevel; }
    public void    setCurrentLevel(int level)  { this.currentLevel = level; }
    public double  getCurrentXp()              { return currentXp; }
    public void    setCurrentXp(double xp)     { this.currentXp = xp; }
    public long    getXpRequired()             { return xpRequired; }
    public void    setXpRequired(long req)     { this.xpRequired = req; }
    public boolean isBreakthroughAvailable()   { return breakthroughAvailable; }
    public void    setBreakthroughAvailable(boolean b) { this.breakthroughAvailable = b; }
    public boolean isUnlocked()                { return unlocked; }
    public void    setUnlocked(boolean u)      { this.unlocked = u; }

    /**
     * Adds XP, clamping at the requirement.
     * @return true if this call filled the bar
     */
    public boolean gainXp(double amount) {
        if (amount <= 0 || breakthroughAvailable) return false;
        currentXp += amount;
        if (currentXp >= xpRequired) {
            currentXp = xpRequired;
            breakthroughAvailable = true;
            return true;
        }
        return false;
    }

    /** Moves to {@code level}, recomputing the requirement and clearing the ready flag. */
    public void resetTo(int level, double xpFraction) {
        currentLevel = level;
        xpRequired = Progression.xpRequired(level);
        currentXp = xpRequired * xpFraction;
        breakthroughAvailable = false;
    }
}
