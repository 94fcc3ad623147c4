package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

/** Doubles the XP of the next tick only. */
public record ClickBoostCmd(long seq) implements PlayingPhaseCmd {}
