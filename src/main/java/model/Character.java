package model;

import config.GameDefs.Background;
import config.GameDefs.BodyType;
import config.GameDefs.SpiritRoot;

/** Creation traits plus the few fields that outlive a single life. */
public class Character {
    public static final int MAX_KARMA = 1000;

    // ----- creation traits -----
    private String     name;
    private SpiritRoot spiritRoot;
    private BodyType   bodyType;
    private Background background;
    private double     luck;

    // ----- mutable -----
    private int     karma;
    private boolean rogueStatus;
    private int     rebirthCount;
    private double  legacyBonus;
    private boolean devilMark;
    private boolean redeemedDevil;

    public Character() { }

    public Character(String name, SpiritRoot spiritRoot, BodyType bodyType, Background background, double luck) {
        this.name = name;
        this.spiritRoot = spiritRoot;
        this.bodyType = bodyType;
        this.background = background;
        this.luck = luck;
    }

    public String     getName()                  { return name; }
    public void       setName(String name)       { this.name = name; }
    public SpiritRoot getSpiritRoot()            { return spiritRoot; }
    public void       setSpiritRoot(SpiritRoot r){ this.spiritRoot = r; }
    public BodyType   getBodyType()              { return bodyType; }
    public void       setBodyType(BodyType b)    { this.bodyType = b; }
    public Background getBackground()            { return background; }
    public void       setBackground(Background b){ this.background = b; }
    public double     getLuck()                  { return luck; }
    public void       setLuck(double luck)       { this.luck = luck; }

    public int     getKarma()                    { return karma; }
    public void    setKarma(int karma)           { this.karma = clampKarma(karma); }
    public boolean isRogueStatus()               { return rogueStatus; }
    public void    setRogueStatus(boolean r)     { this.rogueStatus = r; }
    public int     getRebirthCount()             { return rebirthCount; }
    public void    setRebirthCount(int n)        { this.rebirthCount = n; }
    public double  getLegacyBonus()              { return legacyBonus; }
    public void    setLegacyBonus(double b)      { this.legacyBonus = b; }
    public boolean isDevilMark()                 { return devilMark; }
    public void    setDevilMark(boolean m)       { this.devilMark = m; }
    public boolean isRedeemedDevil()             { return redeemedDevil; }
    public void    setRedeemedDevil(boolean r)   { this.redeemedDevil = r; }

    public void shiftKarma(int delta) { setKarma(karma + delta); }

    // ----- derived multipliers used by path speed rules -----
    public double qi()      { return spiritRoot == null ? 0 : spiritRoot.qiMultiplier(); }
    public double qiBonus() { return bodyType == null ? 0 : bodyType.qiBonusMultiplier(); }
    public double body()    { return bodyType == null ? 0 : bodyType.bodyMultiplier(); }

    public static int clampKarma(int karma) {
        return Math.max(-MAX_KARMA, Math.min(MAX_KARMA, karma));
    }
}
