package common.dto.cmd;

import common.dto.cmd.marker.CreationPhaseCmd;

public record RerollCmd(long seq) implements CreationPhaseCmd {}
