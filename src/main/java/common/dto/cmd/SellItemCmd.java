package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record SellItemCmd(long seq, String itemId) implements PlayingPhaseCmd {}
