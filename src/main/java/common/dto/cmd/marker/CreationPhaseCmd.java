package common.dto.cmd.marker;

import common.dto.cmd.PlayerCommand;

/** Accepted only while the character is still being rolled. */
public interface CreationPhaseCmd extends PlayerCommand { }
