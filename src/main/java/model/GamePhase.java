package model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum GamePhase {
    @JsonProperty("character_creation") CHARACTER_CREATION,
    @JsonProperty("playing")            PLAYING
}
