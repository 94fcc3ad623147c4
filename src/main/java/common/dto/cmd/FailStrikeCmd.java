package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

/** The player gives in to the armed strike instead of waiting out the window. */
public record FailStrikeCmd(long seq) implements PlayingPhaseCmd {}
