package com.jamcycle.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class BallotRejectedException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public BallotRejectedException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static BallotRejectedException unknownTenant(String tenantId) {
        return new BallotRejectedException(
                HttpStatus.NOT_FOUND,
                "unknown_tenant",
                "Unknown tenant: " + tenantId
        );
    }

    public static BallotRejectedException phaseClosed(String detail) {
        return new BallotRejectedException(
                HttpStatus.CONFLICT,
                "phase_closed",
                detail
        );
    }

    public static BallotRejectedException teamNameTaken(String detail) {
        return new BallotRejectedException(
                HttpStatus.CONFLICT,
                "team_name_taken",
                detail
        );
    }

    public static BallotRejectedException memberAlreadyEntered(String detail) {
        return new BallotRejectedException(
                HttpStatus.CONFLICT,
                "member_already_entered",
                detail
        );
    }

    public static BallotRejectedException unknownTeam(String detail) {
        return new BallotRejectedException(
                HttpStatus.NOT_FOUND,
                "unknown_team",
                detail
        );
    }
}
