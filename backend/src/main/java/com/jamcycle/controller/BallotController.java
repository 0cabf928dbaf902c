package com.jamcycle.controller;

import com.jamcycle.controller.dto.CastVoteRequest;
import com.jamcycle.controller.dto.SubmissionResponse;
import com.jamcycle.controller.dto.SubmitTeamRequest;
import com.jamcycle.controller.dto.VoteResponse;
import com.jamcycle.service.BallotService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for team entries and votes of a tenant's current cycle.
 */
@RestController
@RequestMapping("/api/tenants/{tenantId}")
@RequiredArgsConstructor
public class BallotController {

    private final BallotService ballotService;

    /**
     * Enter a team. Re-entering the same team with the same members is accepted and reported as
     * already entered.
     */
    @PostMapping("/submissions")
    public ResponseEntity<SubmissionResponse> submitTeam(
            @PathVariable String tenantId,
            @Valid @RequestBody SubmitTeamRequest request) {
        BallotService.SubmissionReceipt receipt =
                ballotService.submitTeam(tenantId, request.teamName(), request.memberIds());
        HttpStatus status = receipt.alreadyEntered() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(SubmissionResponse.from(receipt));
    }

    @PostMapping("/votes")
    public ResponseEntity<VoteResponse> castVote(
            @PathVariable String tenantId,
            @Valid @RequestBody CastVoteRequest request) {
        BallotService.VoteReceipt receipt = ballotService.castVote(tenantId, request.userId(), request.teamName());
        return ResponseEntity.ok(VoteResponse.from(receipt));
    }
}
