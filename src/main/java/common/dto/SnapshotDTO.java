// common/dto/SnapshotDTO.java
package common.dto;

import java.util.List;

/** Read-only view of a game for presentation. */
public record SnapshotDTO(
        long tick,
        String phase,
        CharacterDTO character,
        String action,
        String activePathId,
        long spiritStones,
        String location,
        String travelingTo,
        int travelSecondsLeft,
        List<PathDTO> paths,
        List<BuffDTO> buffs,
        int qiDeviationSeconds,
        List<String> inventory,
        String equippedScripture,
        String group,
        String pendingEventId,
        TribulationDTO tribulation,
        int power,
        List<String> log
) {}
