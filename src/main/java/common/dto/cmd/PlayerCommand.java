// common/dto/cmd/PlayerCommand.java
package common.dto.cmd;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Every player intent crosses the session boundary as one of these. {@code seq} deduplicates. */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "type"
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = RerollCmd.class,              name = "reroll"),
        @JsonSubTypes.Type(value = ConfirmCharacterCmd.class,    name = "confirmCharacter"),
        @JsonSubTypes.Type(value = SetActionCmd.class,           name = "setAction"),
        @JsonSubTypes.Type(value = SelectPathCmd.class,          name = "selectPath"),
        @JsonSubTypes.Type(value = AttemptBreakthroughCmd.class, name = "attemptBreakthrough"),
        @JsonSubTypes.Type(value = ResistStrikeCmd.class,        name = "resistStrike"),
        @JsonSubTypes.Type(value = FailStrikeCmd.class,          name = "failStrike"),
        @JsonSubTypes.Type(value = AbandonTribulationCmd.class,  name = "abandonTribulation"),
        @JsonSubTypes.Type(value = BuyBoostCmd.class,            name = "buyBoost"),
        @JsonSubTypes.Type(value = UseItemCmd.class,             name = "useItem"),
        @JsonSubTypes.Type(value = EquipScriptureCmd.class,      name = "equipScripture"),
        @JsonSubTypes.Type(value = TravelToCmd.class,            name = "travelTo"),
        @JsonSubTypes.Type(value = ChooseEventOptionCmd.class,   name = "chooseEventOption"),
        @JsonSubTypes.Type(value = BuyItemCmd.class,             name = "buyItem"),
        @JsonSubTypes.Type(value = SellItemCmd.class,            name = "sellItem"),
        @JsonSubTypes.Type(value = ToggleRogueCmd.class,         name = "toggleRogue"),
        @JsonSubTypes.Type(value = JoinGroupCmd.class,           name = "joinGroup"),
        @JsonSubTypes.Type(value = CompleteMissionCmd.class,     name = "completeMission"),
        @JsonSubTypes.Type(value = ClickBoostCmd.class,          name = "clickBoost"),
        @JsonSubTypes.Type(value = SetAutoSaveCmd.class,         name = "setAutoSave"),
})
public interface PlayerCommand {
    long seq();
}
