package config;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What the character is doing each tick. Every path declares the action that feeds it. */
public enum ActionType {
    @JsonProperty("cultivate") CULTIVATE,
    @JsonProperty("train")     TRAIN,
    @JsonProperty("explore")   EXPLORE,
    @JsonProperty("refine")    REFINE,
    @JsonProperty("inscribe")  INSCRIBE,
    @JsonProperty("forge")     FORGE,
    @JsonProperty("study")     STUDY,
    @JsonProperty("sleep")     SLEEP,
    @JsonProperty("idle")      IDLE;

    public String label() {
        return name().charAt(0) + name().substring(1).toLowerCase();
    }
}
