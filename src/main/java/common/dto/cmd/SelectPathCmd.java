package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record SelectPathCmd(long seq, String pathId) implements PlayingPhaseCmd {}
