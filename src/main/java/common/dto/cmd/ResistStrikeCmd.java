package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record ResistStrikeCmd(long seq) implements PlayingPhaseCmd {}
