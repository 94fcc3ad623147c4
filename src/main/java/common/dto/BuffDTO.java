package common.dto;

public record BuffDTO(String id, String name, double multiplier, int remainingSeconds) {}
