package model.systems;

import config.ActionType;
import config.GameData;
import config.GameDefs.Background;
import config.GameDefs.BodyType;
import config.GameDefs.BonusEffect;
import config.GameDefs.RegionDef;
import config.GameDefs.SpiritRoot;
import model.ActionResult;
import model.Character;
import model.EventLog;
import model.GamePhase;
import model.GameState;
import model.Inventory;
import model.LogType;
import model.PathProgress;
import model.RandomTables;
import model.SimulationContext;

/** Rolls characters and builds the state a new life starts from. */
public final class CharacterCreation {
    static final String STARTER_SCRIPTURE = "basic_scripture";

    private final GameData data;
    private final SimulationContext ctx;

    public CharacterCreation(GameData data, SimulationContext ctx) {
        this.data = data;
        this.ctx = ctx;
    }

    public Character rollCharacter(String name) {
        SpiritRoot root = RandomTables.weightedPick(data.spiritRoots(), SpiritRoot::probability, ctx.dice);
        BodyType body = RandomTables.weightedPick(data.bodyTypes(), BodyType::probability, ctx.dice);
        Background bg = RandomTables.pickUniform(data.backgrounds(), ctx.dice);
        double luck = RandomTables.rollLuck(ctx.dice);
        return new Character(name, root, body, bg, luck);
    }

    /** 0 for the first reroll, then 10, 100, 1000... */
    public static long rerollCost(int rerollCount) {
        return rerollCount == 0 ? 0 : (long) Math.pow(10, rerollCount);
    }

    /** A draft held in the creation phase until the player accepts a roll. */
    public GameState beginCreation(String name) {
        GameState draft = new GameState();
        draft.setGamePhase(GamePhase.CHARACTER_CREATION);
        draft.setCharacter(rollCharacter(name));
        draft.setLastSaveTimestamp(ctx.now());
        return draft;
    }

    public ActionResult reroll(GameState draft) {
        if (draft.getGamePhase() != GamePhase.CHARACTER_CREATION) return ActionResult.fail("Character already chosen");
        long cost = rerollCost(draft.getRerollCount());
        if (draft.getSpiritStones() < cost) return ActionResult.fail("Re-roll costs " + cost + " Spirit Stones");

        draft.addStones(-cost);
        draft.setCharacter(rollCharacter(draft.getCharacter().getName()));
        draft.setRerollCount(draft.getRerollCount() + 1);
        return ActionResult.ok("Re-rolled (cost " + cost + ")");
    }

    /** Accepts the drafted character; stones left over from re-rolls carry into the new game. */
    public GameState confirm(GameState draft) {
        GameState state = createInitialState(draft.getCharacter());
        state.setRerollCount(draft.getRerollCount());
        state.addStones(draft.getSpiritStones());
        return state;
    }

    public GameState createInitialState(Character character) {
        BonusEffect bonus = character.getBackground().bonusEffect();
        String start = character.getBackground().startLocation();

        GameState s = new GameState();
        s.setCharacter(character);
        s.getPathProgress().put("martial", PathProgress.unlockedAtStart("martial"));
        s.setActivePathId("martial");
        s.setCurrentAction(ActionType.IDLE);
        s.setCurrentLocationId(start);
        s.getDiscoveredRegions().add(start);
        RegionDef region = data.region(start);
        if (region != null) s.getDiscoveredRegions().addAll(region.connections());

        s.setSpiritStones(bonus.spiritStones());
        if (bonus.randomScripture()) {
            Inventory.add(s, data.item(STARTER_SCRIPTURE), 1);
            s.getPathProgress().put("spirit", PathProgress.unlockedAtStart("spirit"));
        }
        double luckBoost = bonus.hiddenLuck() + bonus.luckBonus();
        if (luckBoost > 0) character.setLuck(Math.min(1.0, character.getLuck() + luckBoost));

        s.setLastSaveTimestamp(ctx.now());
        s.setGamePhase(GamePhase.PLAYING);

        EventLog.add(s, ctx, "Your journey on the Grand Dao begins...", LogType.SYSTEM);
        EventLog.info(s, ctx, "Spirit Root: " + character.getSpiritRoot().name() + " (" + character.getSpiritRoot().qiMultiplier() + "x)");
        EventLog.info(s, ctx, "Body Type: " + character.getBodyType().name() + " (" + character.getBodyType().bodyMultiplier() + "x)");
        EventLog.info(s, ctx, "Background: " + character.getBackground().name());
        EventLog.add(s, ctx, "Train to strengthen your body. Explore to find Scriptures and unlock Cultivation!", LogType.SYSTEM);
        return s;
    }
}
