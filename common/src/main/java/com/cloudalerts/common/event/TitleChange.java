package com.cloudalerts.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TitleChange(
        @JsonProperty("old_value") String oldValue,
        @JsonProperty("new_value") String newValue) {}
