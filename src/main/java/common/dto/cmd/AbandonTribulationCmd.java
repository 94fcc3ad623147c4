package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record AbandonTribulationCmd(long seq) implements PlayingPhaseCmd {}
