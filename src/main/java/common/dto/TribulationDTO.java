package common.dto;

public record TribulationDTO(
        String pathId,
        String phase,
        int currentStrike,
        int totalStrikes,
        int hp,
        int maxHp,
        int windowSeconds,
        boolean strikeArmed
) {}
