package model;

/** Timed XP multiplier. Ticks down once per second and expires at zero. */
public class ActiveBuff {
    private String id;
    private String name;
    private double multiplier;
    private int    remainingSeconds;
    private String icon;

    public ActiveBuff() { }

    public ActiveBuff(String id, String name, double multiplier, int remainingSeconds, String icon) {
        this.id = id;
        this.name = name;
        this.multiplier = multiplier;
        this.remainingSeconds = remainingSeconds;
        this.icon = icon;
    }

    public String getId()               { return id; }
    public void   setId(String id)      { this.id = id; }
    public String getName()             { return name; }
    public void   setName(String name)  { this.name = name; }
    public double getMultiplier()       { return multiplier; }
    public void   setMultiplier(double m) { this.multiplier = m; }
    public int    getRemainingSeconds() { return remainingSeconds; }
    public void   setRemainingSeconds(int s) { this.remainingSeconds = s; }
    public String getIcon()             { return icon; }
    public void   setIcon(String icon)  { this.icon = icon; }

    /** @return true once the buff has run out */
    public boolean countDown(int seconds) {
        remainingSeconds -= seconds;
        return remainingSeconds <= 0;
    }
}
