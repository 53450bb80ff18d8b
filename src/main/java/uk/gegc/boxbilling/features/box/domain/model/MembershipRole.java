package uk.gegc.boxbilling.features.box.domain.model;

public enum MembershipRole {
    OWNER,
    HEAD_COACH,
    COACH,
    ATHLETE
}
