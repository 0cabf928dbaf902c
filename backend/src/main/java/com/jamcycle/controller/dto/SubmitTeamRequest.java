package com.jamcycle.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.Set;

public record SubmitTeamRequest(
        @NotBlank(message = "teamName is required")
        @Size(max = 100, message = "teamName must be at most 100 characters")
        String teamName,

        @NotEmpty(message = "memberIds must contain at least one member")
        Set<@NotBlank(message = "memberIds must not contain blank ids") String> memberIds
) {
}
