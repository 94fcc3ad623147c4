package common.dto.cmd.marker;

import common.dto.cmd.PlayerCommand;

/** Accepted only once a character is in play. */
public interface PlayingPhaseCmd extends PlayerCommand { }
