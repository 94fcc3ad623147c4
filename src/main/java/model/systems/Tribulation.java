package model.systems;

/**
 * A heavenly tribulation in progress. Strikes alternate between armed (the player must
 * resist within {@code windowSeconds}) and waiting for the next strike.
 */
public final class Tribulation {
    public enum Phase { ACTIVE, SURVIVED, FAILED }

    private final long   generation;
    private final String pathId;
    private final int    level;
    private final int    tier;
    private final int    totalStrikes;
    private final int    maxHp;
    private final int    windowSeconds;

    private int     currentStrike;
    private int     hp;
    private boolean strikeArmed;
    private Phase   phase = Phase.ACTIVE;

    Tribulation(long generation, String pathId, int level, int tier, int totalStrikes, int maxHp, int windowSeconds) {
        this.generation = generation;
        this.pathId = pathId;
        this.level = level;
        this.tier = tier;
        this.totalStrikes = totalStrikes;
        this.maxHp = maxHp;
        this.hp = maxHp;
        this.windowSeconds = windowSeconds;
    }

    public long    generation()    { return generation; }
    public String  pathId()        { return pathId; }
    public int     level()         { return level; }
    public int     tier()          { return tier; }
    public int     totalStrikes()  { return totalStrikes; }
    public int     maxHp()         { return maxHp; }
    public int     windowSeconds() { return windowSeconds; }
    public int     currentStrike() { return currentStrike; }
    public int     hp()            { return hp; }
    public boolean strikeArmed()   { return strikeArmed; }
    public Phase   phase()         { return phase; }

    public boolean isActive()      { return phase == Phase.ACTIVE; }
    public int     strikeDamage()  { return (int) Math.floor(maxHp * 0.3); }

    void arm() {
        if (isActive()) strikeArmed = true;
    }

    void resisted() {
        strikeArmed = false;
        advance();
    }

    void struck() {
        strikeArmed = false;
        hp = Math.max(0, hp - strikeDamage());
        if (hp <= 0) {
            phase = Phase.FAILED;
            return;
        }
        advance();
    }

    private void advance() {
        currentStrike++;
        if (currentStrike >= totalStrikes) phase = Phase.SURVIVED;
    }
}
