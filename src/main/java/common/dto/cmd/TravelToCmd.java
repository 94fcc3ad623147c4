package common.dto.cmd;

import common.dto.cmd.marker.PlayingPhaseCmd;

public record TravelToCmd(long seq, String regionId) implements PlayingPhaseCmd {}
