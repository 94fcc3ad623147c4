package model.systems;

import config.GameData;
import config.GameDefs.GroupDef;
import config.GameDefs.MissionDef;
import config.GameDefs.MissionOption;
import model.ActionResult;
import model.EventLog;
import model.GameState;
import model.LogType;
import model.SimulationContext;

import java.util.ArrayList;
import java.util.List;

/** Sects, cults and associations: membership and missions. */
public final class GroupSystem {
    private final GameData data;
    private final UnlockSystem unlocks;
    private final SimulationContext ctx;

    public GroupSystem(GameData data, UnlockSystem unlocks, SimulationContext ctx) {
        this.data = data;
        this.unlocks = unlocks;
        this.ctx = ctx;
    }

    public boolean canJoin(GameState s, GroupDef g) {
        if (s.getCharacter().isRogueStatus()) return false;
        boolean reachable = s.getDiscoveredRegions().contains(g.location())
                || s.getCharacter().getBackground().bonusEffect().sectAccess();
        return g.karmaRequirement().contains(s.getCharacter().getKarma()) && reachable;
    }

    public List<GroupDef> available(GameState s) {
        List<GroupDef> out = new ArrayList<>();
        for (GroupDef g : data.groups()) if (canJoin(s, g)) out.add(g);
        return out;
    }

    public ActionResult join(GameState s, String groupId) {
        GroupDef g = data.group(groupId);
        if (g == null) return ActionResult.fail("Unknown group: " + groupId);
        if (groupId.equals(s.getGroupMembership())) return ActionResult.fail("Already a member of " + g.name());
        if (!canJoin(s, g)) return ActionResult.fail(g.name() + " will not accept you");

        s.setGroupMembership(groupId);
        s.setGroupContribution(0);
        s.getCompletedMissions().clear();
        EventLog.success(s, ctx, "Joined " + g.name() + "!");
        return ActionResult.ok("Joined " + g.name());
    }

    public ActionResult completeMission(GameState s, String missionId, boolean help) {
        GroupDef g = data.group(s.getGroupMembership());
        if (g == null) return ActionResult.fail("You are not in a group");

        MissionDef mission = null;
        for (MissionDef m : g.missions()) if (m.id().equals(missionId)) mission = m;
        if (mission == null) return ActionResult.fail("Unknown mission: " + missionId);
        if (s.getCompletedMissions().contains(missionId)) return ActionResult.fail(mission.name() + " is already done");

        MissionOption option = help ? mission.helpOption() : mission.exploitOption();
        if (option == null) return ActionResult.fail("That option is not offered");

        s.addStones(option.reward());
        s.setGroupContribution(s.getGroupContribution() + option.reward());
        s.getCharacter().shiftKarma(option.karmaChange());
        s.getCompletedMissions().add(missionId);

        String karma = (option.karmaChange() > 0 ? "+" : "") + option.karmaChange();
        EventLog.add(s, ctx, "Mission complete: " + mission.name() + " (+" + option.reward() + " SS, " + karma + " Karma)",
                option.karmaChange() >= 0 ? LogType.SUCCESS : LogType.WARNING);
        unlocks.checkPathUnlocks(s);
        return ActionResult.ok(mission.name() + " complete");
    }
}
