package config;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Rarity {
    @JsonProperty("common")    COMMON,
    @JsonProperty("uncommon")  UNCOMMON,
    @JsonProperty("rare")      RARE,
    @JsonProperty("epic")      EPIC,
    @JsonProperty("legendary") LEGENDARY,
    @JsonProperty("mythic")    MYTHIC
}
