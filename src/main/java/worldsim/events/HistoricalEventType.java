package worldsim.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Type tags of the historical-event stream. The tag is what observers and the
 * persisted log see.
 */
public enum HistoricalEventType {
    WAR_DECLARED("war_declared"),
    WAR_ENDED("war_ended"),
    BATTLE_RESOLVED("battle_resolved"),
    TRADE_COMPLETED("trade_completed"),
    TRADE_FAILED("trade_failed"),
    MARKET_CRASH("market_crash"),
    POLITICAL_SHIFT("political_shift"),
    DIPLOMATIC_SHIFT("diplomatic_shift"),
    ENCOUNTER_TRIGGERED("encounter_triggered"),
    ENCOUNTER_RESOLVED("encounter_resolved"),
    ENCOUNTER_ABORTED("encounter_aborted");

    private final String tag;

    HistoricalEventType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static HistoricalEventType fromTag(String tag) {
        return Arrays.stream(values())
                .filter(type -> type.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown historical event type: " + tag));
    }
}
