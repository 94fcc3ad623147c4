package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record UseItemCmd(long seq, String itemId) implements PlayingPhaseCmd {}
