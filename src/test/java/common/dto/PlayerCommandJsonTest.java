package common.dto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import common.dto.cmd.CompleteMissionCmd;
import common.dto.cmd.FailStrikeCmd;
import common.dto.cmd.PlayerCommand;
import common.dto.cmd.RerollCmd;
import common.dto.cmd.SetActionCmd;
import common.dto.cmd.TravelToCmd;
import config.ActionType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlayerCommandJsonTest {
    private final ObjectMapper M = Json.mapper();

    @Test
    void typeTagSelectsTheCommand() throws JsonProcessingException {
        PlayerCommand cmd = M.readValue("{\"type\":\"setAction\",\"seq\":5,\"action\":\"train\"}", PlayerCommand.class);
        SetActionCmd set = assertInstanceOf(SetActionCmd.class, cmd);
        assertEquals(5, set.seq());
        assertEquals(ActionType.TRAIN, set.action());
    }

    @Test
    void argumentsBindByName() throws JsonProcessingException {
        CompleteMissionCmd c = (CompleteMissionCmd) M.readValue(
                "{\"type\":\"completeMission\",\"seq\":9,\"missionId\":\"patrol_1\",\"help\":true}", PlayerCommand.class);
        assertEquals("patrol_1", c.missionId());
        assertTrue(c.help());

        TravelToCmd t = (TravelToCmd) M.readValue("{\"seq\":2,\"type\":\"travelTo\",\"regionId\":\"river_delta\"}",
                PlayerCommand.class);
        assertEquals("river_delta", t.regionId());
    }

    @Test
    void seqOnlyCommandsParse() throws JsonProcessingException {
        assertInstanceOf(RerollCmd.class, M.readValue("{\"type\":\"reroll\",\"seq\":1}", PlayerCommand.class));
        assertInstanceOf(FailStrikeCmd.class, M.readValue("{\"type\":\"failStrike\",\"seq\":4}", PlayerCommand.class));
    }

    @Test
    void unknownTypeIsRejected() {
        assertThrows(JsonProcessingException.class,
                () -> M.readValue("{\"type\":\"flyAway\",\"seq\":1}", PlayerCommand.class));
    }

    @Test
    void writtenCommandsCarryTheirTag() throws JsonProcessingException {
        String json = M.writerFor(PlayerCommand.class).writeValueAsString(new RerollCmd(3));
        assertTrue(json.contains("\"type\":\"reroll\""), json);
    }
}
