package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record BuyItemCmd(long seq, String itemId) implements PlayingPhaseCmd {}
