package common.dto;

public record PathDTO(
        String id,
        String name,
        String levelName,
        String tierName,
        int level,
        double currentXp,
        long xpRequired,
        boolean breakthroughAvailable,
        double breakthroughChance
) {}
