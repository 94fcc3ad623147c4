package model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LogType {
    @JsonProperty("info")      INFO,
    @JsonProperty("success")   SUCCESS,
    @JsonProperty("warning")   WARNING,
    @JsonProperty("danger")    DANGER,
    @JsonProperty("legendary") LEGENDARY,
    @JsonProperty("system")    SYSTEM
}
