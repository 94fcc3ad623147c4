package common.dto.cmd;

import common.dto.cmd.marker.CreationPhaseCmd;

public record ConfirmCharacterCmd(long seq) implements CreationPhaseCmd {}
