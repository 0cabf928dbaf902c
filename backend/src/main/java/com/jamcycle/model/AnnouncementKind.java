package com.jamcycle.model;

public enum AnnouncementKind {
    SUBMISSION_START,
    VOTING_START,
    SUBMISSION_REMINDER,
    VOTING_REMINDER,
    WEEK_CANCELLED,
    WINNER,
    NO_WINNER,
    FACE_OFF_START,
    THEME_PROPOSAL,
    CONFIRMATION_REQUEST
}
