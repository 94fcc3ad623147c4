package common.dto;

public record CharacterDTO(
        String name,
        String spiritRoot,
        String bodyType,
        String background,
        String luck,          // descriptor only; the raw value stays hidden
        String karma,         // label, or "???" until karma becomes visible
        boolean rogue,
        int rebirthCount,
        double legacyBonus,
        boolean devilMark
) {}
