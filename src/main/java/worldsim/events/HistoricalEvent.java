package worldsim.events;

import java.util.Objects;

/**
 * Entry of the append-only historical-event stream.
 *
 * @param timestamp           simulated turn the event belongs to
 * @param subject             id of the war, battle, faction, resource or encounter concerned
 * @param consciousnessImpact signed impact annotation; negative values are harmful
 */
public record HistoricalEvent(
        long timestamp,
        HistoricalEventType type,
        String subject,
        String description,
        double consciousnessImpact
) {

    public HistoricalEvent {
        Objects.requireNonNull(type, "Historical event type cannot be null");
        description = description == null ? "" : description;
    }

    public static HistoricalEvent of(long timestamp, HistoricalEventType type, String subject, String description) {
        return new HistoricalEvent(timestamp, type, subject, description, 0.0);
    }
}
