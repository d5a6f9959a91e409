package com.costtracker.costs.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;

public record UserDetailsResponseDto(
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        long id,
        BigDecimal total
) {
}
