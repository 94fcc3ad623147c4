package model;

/** Halves XP gain while active. */
public class QiDeviation {
    private boolean active;
    private int     remainingSeconds;

    public QiDeviation() { }

    public boolean isActive()                 { return active; }
    public void    setActive(boolean active)  { this.active = active; }
    public int     getRemainingSeconds()      { return remainingSeconds; }
    public void    setRemainingSeconds(int s) { this.remainingSeconds = s; }

    public void start(int seconds) {
        active = true;
        remainingSeconds = seconds;
    }

    public void clear() {
        active = false;
        remainingSeconds = 0;
    }
}
