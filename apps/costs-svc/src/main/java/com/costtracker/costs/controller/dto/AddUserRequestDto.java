package com.costtracker.costs.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

public record AddUserRequestDto(
        Long id,
        @JsonProperty("first_name") @Size(max = 255) String firstName,
        @JsonProperty("last_name") @Size(max = 255) String lastName,
        String birthday
) {
}
