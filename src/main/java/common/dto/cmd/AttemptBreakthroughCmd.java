package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

/** Starts a tribulation instead when the active path sits at a tier boundary. */
public record AttemptBreakthroughCmd(long seq) implements PlayingPhaseCmd {}
