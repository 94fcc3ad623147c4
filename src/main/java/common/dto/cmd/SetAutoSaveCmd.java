package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record SetAutoSaveCmd(long seq, boolean enabled) implements PlayingPhaseCmd {}
