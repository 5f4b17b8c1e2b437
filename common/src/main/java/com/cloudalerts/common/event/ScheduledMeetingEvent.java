package com.cloudalerts.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Set;
import lombok.Builder;

/**
 * New, updated or deleted scheduled meeting. {@code changes} and {@code titleChange} are
 * only meaningful for {@code UPDATED_SCHEDULED_MEETING}; a change set naming
 * {@link ScheduledMeetingChange#TITLE} must come with a title change.
 */
@Builder(toBuilder = true)
public record ScheduledMeetingEvent(
        ChangeEventKind kind,
        @JsonProperty("user_handle") long userHandle,
        @JsonProperty("meeting_handle") long meetingHandle,
        @JsonProperty("parent_meeting_handle") long parentMeetingHandle,
        Set<ScheduledMeetingChange> changes,
        @JsonProperty("title_change") TitleChange titleChange,
        Instant timestamp) implements ChangeEvent {}
