package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record BuyBoostCmd(long seq) implements PlayingPhaseCmd {}
