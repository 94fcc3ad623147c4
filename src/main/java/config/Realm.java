package config;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum Realm {
    @JsonProperty("mortal")     MORTAL,
    @JsonProperty("heaven")     HEAVEN,
    @JsonProperty("underworld") UNDERWORLD
}
