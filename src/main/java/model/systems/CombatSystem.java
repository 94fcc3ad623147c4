package model.systems;

import config.GameData;
import model.GameState;
import model.PathProgress;
import model.RandomTables;
import model.SimulationContext;
import model.paths.PathRules;

public final class CombatSystem {
    public record CombatResult(boolean won, int playerPower, String message) { }

    private final GameData data;
    private final PathRules rules;
    private final SimulationContext ctx;

    public CombatSystem(GameData data, PathRules rules, SimulationContext ctx) {
        this.data = data;
        this.rules = rules;
        this.ctx = ctx;
    }

    /** Sum of level x speed x 10 over every unlocked path. */
    public int power(GameState s) {
        double power = 0;
        for (PathProgress pp : s.getPathProgress().values()) {
            if (!pp.isUnlocked() || data.path(pp.getPathId()) == null) continue;
            power += pp.getCurrentLevel() * rules.speed(pp.getPathId(), s) * 10;
        }
        return (int) Math.floor(power);
    }

    public CombatResult resolve(GameState s, int enemyPower) {
        int mine = power(s);
        double ratio = mine / (double) Math.max(1, enemyPower);

        if (ratio > 1.2) return new CombatResult(true, mine, "Overwhelming victory!");
        if (ratio > 0.8) {
            boolean won = RandomTables.chance(ctx.dice, 0.7);
            return new CombatResult(won, mine, won ? "Hard-fought victory!" : "Narrowly defeated...");
        }
        boolean won = RandomTables.chance(ctx.dice, 0.3);
        return new CombatResult(won, mine, won ? "Miraculous upset!" : "Overwhelmingly defeated!");
    }
}
