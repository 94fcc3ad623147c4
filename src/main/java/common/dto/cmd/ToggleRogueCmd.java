package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record ToggleRogueCmd(long seq) implements PlayingPhaseCmd {}
