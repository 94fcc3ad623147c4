package model;

import config.ActionType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate root of one save. Mutated in place by the engine on the tick thread;
 * rebirth builds a fresh instance.
 */
public class GameState {
    // ----- character & paths -----
    private Character character;
    private Map<String, PathProgress> pathProgress = new LinkedHashMap<>();
    private ActionType currentAction = ActionType.IDLE;
    private String activePathId;

    // ----- wealth -----
    private long spiritStones;
    private List<InventoryItem> inventory = new ArrayList<>();
    private String equippedScripture;

    // ----- world -----
    private String currentLocationId;
    private Set<String> discoveredRegions = new LinkedHashSet<>();
    private TravelState travel = new TravelState();
    private String pendingEventId;

    // ----- effects -----
    private List<ActiveBuff> buffs = new ArrayList<>();
    private QiDeviation qiDeviation = new QiDeviation();

    // ----- groups -----
    private String groupMembership;
    private long groupContribution;
    private List<String> completedMissions = new ArrayList<>();

    // ----- bookkeeping -----
    private List<LogEntry> log = new ArrayList<>();
    private long totalPlayTime;
    private long lastSaveTimestamp;
    private boolean karmaVisible;
    private boolean autoSaveEnabled = true;
    private GamePhase gamePhase = GamePhase.CHARACTER_CREATION;
    private int rerollCount;
    private long tickCount;
    private int highestPathLevel = 1;
    private int totalDeaths;
    private List<String> achievements = new ArrayList<>();

    public GameState() { }

    public Character getCharacter()                        { return character; }
    public void      setCharacter(Character c)             { this.character = c; }
    public Map<String, PathProgress> getPathProgress()     { return pathProgress; }
    public void setPathProgress(Map<String, PathProgress> m) { this.pathProgress = new LinkedHashMap<>(m); }
    public ActionType getCurrentAction()                   { return currentAction; }
    public void       setCurrentAction(ActionType a)       { this.currentAction = a; }
    public String     getActivePathId()                    { return activePathId; }
    public void       setActivePathId(String id)           { this.activePathId = id; }

    public long getSpiritStones()                          { return spiritStones; }
    public void setSpiritStones(long s)                    { this.spiritStones = Math.max(0, s); }
    public List<InventoryItem> getInventory()              { return inventory; }
    public void setInventory(List<InventoryItem> items)    { this.inventory = new ArrayList<>(items); }
    public String getEquippedScripture()                   { return equippedScripture; }
    public void   setEquippedScripture(String id)          { this.equippedScripture = id; }

    public String getCurrentLocationId()                   { return currentLocationId; }
    public void   setCurrentLocationId(String id)          { this.currentLocationId = id; }
    public Set<String> getDiscoveredRegions()              { return discoveredRegions; }
    public void setDiscoveredRegions(Set<String> ids)      { this.discoveredRegions = new LinkedHashSet<>(ids); }
    public TravelState getTravel()                         { return travel; }
    public void        setTravel(TravelState t)            { this.travel = t == null ? new TravelState() : t; }
    public String getPendingEventId()                      { return pendingEventId; }
    public void   setPendingEventId(String id)             { this.pendingEventId = id; }

    public List<ActiveBuff> getBuffs()                     { return buffs; }
    public void setBuffs(List<ActiveBuff> buffs)           { this.buffs = new ArrayList<>(buffs); }
    public QiDeviation getQiDeviation()                    { return qiDeviation; }
    public void        setQiDeviation(QiDeviation d)       { this.qiDeviation = d == null ? new QiDeviation() : d; }

    public String getGroupMembership()                     { return groupMembership; }
    public void   setGroupMembership(String id)            { this.groupMembership = id; }
    public long   getGroupContribution()                   { return groupContribution; }
    public void   setGroupContribution(long c)             { this.groupContribution = c; }
    public List<String> getCompletedMissions()             { return completedMissions; }
    public void setCompletedMissions(List<String> ids)     { this.completedMissions = new ArrayList<>(ids); }

    public List<LogEntry> getLog()                         { return log; }
    public void setLog(List<LogEntry> log)                 { this.log = new ArrayList<>(log); }
    public long getTotalPlayTime()                         { return totalPlayTime; }
    public void setTotalPlayTime(long seconds)             { this.totalPlayTime = seconds; }
    public long getLastSaveTimestamp()                     { return lastSaveTimestamp; }
    public void setLastSaveTimestamp(long millis)          { this.lastSaveTimestamp = millis; }
    public boolean isKarmaVisible()                        { return karmaVisible; }
    public void    setKarmaVisible(boolean v)              { this.karmaVisible = v; }
    public boolean isAutoSaveEnabled()                     { return autoSaveEnabled; }
    public void    setAutoSaveEnabled(boolean e)           { this.autoSaveEnabled = e; }
    public GamePhase getGamePhase()                        { return gamePhase; }
    public void      setGamePhase(GamePhase p)             { this.gamePhase = p; }
    public int  getRerollCount()                           { return rerollCount; }
    public void setRerollCount(int n)                      { this.rerollCount = n; }
    public long getTickCount()                             { return tickCount; }
    public void setTickCount(long n)                       { this.tickCount = n; }
    public int  getHighestPathLevel()                      { return highestPathLevel; }
    public void setHighestPathLevel(int level)             { this.highestPathLevel = level; }
    public int  getTotalDeaths()                           { return totalDeaths; }
    public void setTotalDeaths(int n)                      { this.totalDeaths = n; }
    public List<String> getAchievements()                  { return achievements; }
    public void setAchievements(List<String> a)            { this.achievements = new ArrayList<>(a); }

    // ----- convenience (not bean properties) -----

    public PathProgress progressOf(String pathId) {
        return pathId == null ? null : pathProgress.get(pathId);
    }

    public PathProgress activeProgress() {
        return progressOf(activePathId);
    }

    public boolean hasUnlocked(String pathId) {
        PathProgress p = progressOf(pathId);
        return p != null && p.isUnlocked();
    }

    public void addStones(long delta) {
        setSpiritStones(spiritStones + delta);
    }

    public void refreshHighestLevel() {
        int max = 1;
        for (PathProgress p : pathProgress.values()) max = Math.max(max, p.getCurrentLevel());
        highestPathLevel = max;
    }
}
