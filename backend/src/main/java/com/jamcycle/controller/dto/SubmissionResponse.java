package com.jamcycle.controller.dto;

import com.jamcycle.service.BallotService;

import java.util.List;

public record SubmissionResponse(
        String tenantId,
        String cycleKey,
        String teamName,
        List<String> memberIds,
        boolean alreadyEntered
) {
    public static SubmissionResponse from(BallotService.SubmissionReceipt receipt) {
        return new SubmissionResponse(
                receipt.tenantId(),
                receipt.cycleKey(),
                receipt.team().name(),
                receipt.team().memberIds().stream().sorted().toList(),
                receipt.alreadyEntered()
        );
    }
}
