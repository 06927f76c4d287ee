package org.ccwonline.management.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A conference as stored in the {@code Conference} table.
 *
 * @param conferenceId    The key
 * @param name            The display name
 * @param participantsNum The number of registered participants
 * @param status          The workflow status code
 * @param startTime       The scheduled start, or null if not yet scheduled
 */
public record Conference(
        int conferenceId,
        String name,
        int participantsNum,
        int status,
        LocalDateTime startTime
) {
    public Conference {
        Objects.requireNonNull(name, "Conference name cannot be null");
    }

    public Conference(int conferenceId, String name, int participantsNum, int status) {
        this(conferenceId, name, participantsNum, status, null);
    }

    public Conference withParticipantsNum(int participantsNum) {
        return new Conference(conferenceId, name, participantsNum, status, startTime);
    }

    public Conference withStatus(int status) {
        return new Conference(conferenceId, name, participantsNum, status, startTime);
    }
}
