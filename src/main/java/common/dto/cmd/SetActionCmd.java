package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;
import config.ActionType;

public record SetActionCmd(long seq, ActionType action) implements PlayingPhaseCmd {}
