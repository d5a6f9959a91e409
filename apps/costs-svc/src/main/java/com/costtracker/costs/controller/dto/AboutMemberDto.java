package com.costtracker.costs.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AboutMemberDto(
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName
) {
}
