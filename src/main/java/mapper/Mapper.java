// mapper/Mapper.java
package mapper;

import common.dto.*;
import config.GameData;
import config.GameDefs.ItemDef;
import config.GameDefs.PathDef;
import config.GameDefs.RegionDef;
import model.*;
import model.Character;
import model.systems.BreakthroughSystem;
import model.systems.Tribulation;

import java.util.ArrayList;
import java.util.List;

public final class Mapper {
    private Mapper() {}

    /* ------------ public API ------------ */
    public static SnapshotDTO toSnapshot(GameState s, Tribulation trib, GameData data, int power) {
        RegionDef here = data.region(s.getCurrentLocationId());
        RegionDef dest = data.region(s.getTravel().getDestinationId());
        ItemDef scripture = data.item(s.getEquippedScripture());

        return new SnapshotDTO(
                s.getTickCount(),
                s.getGamePhase().name().toLowerCase(),
                toCharacterDTO(s),
                s.getCurrentAction().label(),
                s.getActivePathId(),
                s.getSpiritStones(),
                here != null ? here.name() : s.getCurrentLocationId(),
                s.getTravel().isTraveling() && dest != null ? dest.name() : null,
                s.getTravel().isTraveling() ? s.getTravel().getRemainingSeconds() : 0,
                toPathDTOs(s, data),
                toBuffDTOs(s.getBuffs()),
                s.getQiDeviation().isActive() ? s.getQiDeviation().getRemainingSeconds() : 0,
                toInventoryLines(s, data),
                scripture != null ? scripture.name() : null,
                s.getGroupMembership(),
                s.getPendingEventId(),
                toTribulationDTO(trib),
                power,
                toLogLines(s.getLog())
        );
    }

    public static CharacterDTO toCharacterDTO(GameState s) {
        Character c = s.getCharacter();
        if (c == null) return null;
        return new CharacterDTO(
                c.getName(),
                c.getSpiritRoot() != null ? c.getSpiritRoot().name() : null,
                c.getBodyType() != null ? c.getBodyType().name() : null,
                c.getBackground() != null ? c.getBackground().name() : null,
                Formats.luckDescriptor(c.getLuck()),
                s.isKarmaVisible() ? Formats.karmaLabel(c.getKarma()) + " (" + c.getKarma() + ")" : "???",
                c.isRogueStatus(),
                c.getRebirthCount(),
                c.getLegacyBonus(),
                c.isDevilMark()
        );
    }

    public static List<PathDTO> toPathDTOs(GameState s, GameData data) {
        var out = new ArrayList<PathDTO>(s.getPathProgress().size());
        double luck = s.getCharacter() == null ? 0 : s.getCharacter().getLuck();
        for (PathProgress pp : s.getPathProgress().values()) {
            if (!pp.isUnlocked()) continue;
            PathDef def = data.path(pp.getPathId());
            int lvl = pp.getCurrentLevel();
            out.add(new PathDTO(
                    pp.getPathId(),
                    def != null ? def.name() : pp.getPathId(),
                    def != null ? def.levelName(lvl) : "Level " + lvl,
                    Progression.tierName(lvl),
                    lvl,
                    pp.getCurrentXp(),
                    pp.getXpRequired(),
                    pp.isBreakthroughAvailable(),
                    BreakthroughSystem.successChance(lvl, luck, 0)
            ));
        }
        return out;
    }

    public static List<BuffDTO> toBuffDTOs(List<ActiveBuff> buffs) {
        var out = new ArrayList<BuffDTO>(buffs.size());
        for (ActiveBuff b : buffs) {
            out.add(new BuffDTO(b.getId(), b.getName(), b.getMultiplier(), b.getRemainingSeconds()));
        }
        return out;
    }

    public static TribulationDTO toTribulationDTO(Tribulation t) {
        if (t == null) return null;
        return new TribulationDTO(t.pathId(), t.phase().name().toLowerCase(), t.currentStrike(), t.totalStrikes(),
                t.hp(), t.maxHp(), t.windowSeconds(), t.strikeArmed());
    }

    /* ------------ helpers ------------ */
    private static List<String> toInventoryLines(GameState s, GameData data) {
        var out = new ArrayList<String>(s.getInventory().size());
        for (InventoryItem it : s.getInventory()) {
            ItemDef def = data.item(it.getItemId());
            String name = def != null ? def.name() : it.getItemId();
            out.add(it.getQuantity() > 1 ? name + " x" + it.getQuantity() : name);
        }
        return out;
    }

    private static List<String> toLogLines(List<LogEntry> log) {
        var out = new ArrayList<String>(log.size());
        for (LogEntry e : log) out.add("[" + e.type().name().toLowerCase() + "] " + e.text());
        return out;
    }
}
