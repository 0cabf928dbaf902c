package com.jamcycle.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record CastVoteRequest(
        @NotBlank(message = "userId is required")
        String userId,

        @NotBlank(message = "teamName is required")
        String teamName
) {
}
