package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record ChooseEventOptionCmd(long seq, int choiceIndex) implements PlayingPhaseCmd {}
