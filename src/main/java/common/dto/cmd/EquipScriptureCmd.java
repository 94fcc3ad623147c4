package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record EquipScriptureCmd(long seq, String itemId) implements PlayingPhaseCmd {}
