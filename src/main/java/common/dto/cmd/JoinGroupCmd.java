package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record JoinGroupCmd(long seq, String groupId) implements PlayingPhaseCmd {}
