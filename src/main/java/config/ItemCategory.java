package config;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ItemCategory {
    @JsonProperty("pill")             PILL,
    @JsonProperty("scripture")        SCRIPTURE,
    @JsonProperty("treasure")         TREASURE,
    @JsonProperty("material")         MATERIAL,
    @JsonProperty("formation_scroll") FORMATION_SCROLL,
    @JsonProperty("special")          SPECIAL
}
