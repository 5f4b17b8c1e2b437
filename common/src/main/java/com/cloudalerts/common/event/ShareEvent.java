package com.cloudalerts.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record ShareEvent(
        ChangeEventKind kind,
        @JsonProperty("user_handle") long userHandle,
        String email,
        @JsonProperty("folder_handle") long folderHandle,
        @JsonProperty("owner_handle") long ownerHandle,
        @JsonProperty("folder_path") String folderPath,
        @JsonProperty("folder_name") String folderName,
        Instant timestamp) implements ChangeEvent {}
