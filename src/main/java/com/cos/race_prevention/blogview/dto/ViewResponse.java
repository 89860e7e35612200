package com.cos.race_prevention.blogview.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ViewResponse {

    @JsonProperty("current_views")
    private final Long currentViews;
}
