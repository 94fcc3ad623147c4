package model.systems;

import config.GameData;
import config.GameDefs.RegionDef;
import model.ActionResult;
import model.EventLog;
import model.Formats;
import model.GameState;
import model.LogType;
import model.SimulationContext;
import model.TravelState;

public final class TravelSystem {
    private final GameData data;
    private final SimulationContext ctx;

    public TravelSystem(GameData data, SimulationContext ctx) {
        this.data = data;
        this.ctx = ctx;
    }

    public static int travelSeconds(RegionDef destination) {
        return 30 + destination.dangerLevel() * 30;
    }

    public ActionResult travelTo(GameState s, String regionId) {
        RegionDef target = data.region(regionId);
        if (target == null) return ActionResult.fail("Unknown region: " + regionId);
        if (s.getTravel().isTraveling()) return ActionResult.fail("Already traveling");
        if (regionId.equals(s.getCurrentLocationId())) return ActionResult.fail("Already at " + target.name());

        RegionDef here = data.region(s.getCurrentLocationId());
        if (here == null || !here.connections().contains(regionId)) {
            return ActionResult.fail(target.name() + " is not reachable from here");
        }

        int seconds = travelSeconds(target);
        s.getTravel().depart(regionId, seconds);
        EventLog.add(s, ctx, "Traveling to " + target.name() + "... (" + Formats.duration(seconds) + ")", LogType.INFO);
        return ActionResult.ok("Traveling to " + target.name());
    }

    /** Counts the journey down; returns true if the traveler arrived during this call. */
    public boolean advance(GameState s, long seconds) {
        TravelState t = s.getTravel();
        if (!t.isTraveling()) return false;
        t.setRemainingSeconds((int) Math.max(0, t.getRemainingSeconds() - seconds));
        if (t.getRemainingSeconds() > 0) return false;
        arrive(s);
        return true;
    }

    private void arrive(GameState s) {
        String dest = s.getTravel().getDestinationId();
        s.getTravel().clear();
        RegionDef region = data.region(dest);
        if (region == null) return;

        s.setCurrentLocationId(dest);
        s.getDiscoveredRegions().add(dest);
        s.getDiscoveredRegions().addAll(region.connections());
        EventLog.add(s, ctx, "Arrived at " + region.name(), LogType.SUCCESS);
    }
}
