package com.jamcycle.controller.dto;

import com.jamcycle.service.BallotService;

public record VoteResponse(
        String tenantId,
        String cycleKey,
        String teamName,
        int teamVotes,
        boolean faceOff,
        String previousTeam
) {
    public static VoteResponse from(BallotService.VoteReceipt receipt) {
        return new VoteResponse(
                receipt.tenantId(),
                receipt.cycleKey(),
                receipt.team(),
                receipt.teamVotes(),
                receipt.faceOff(),
                receipt.previousTeam()
        );
    }
}
