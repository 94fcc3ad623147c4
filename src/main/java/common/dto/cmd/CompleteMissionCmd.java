package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

/** {@code help=false} takes the exploit option. */
public record CompleteMissionCmd(long seq, String missionId, boolean help) implements PlayingPhaseCmd {}
