package uk.gegc.boxbilling.features.access.application;

/**
 * @param reason why access was denied; {@code null} when granted
 */
public record AccessDecision(boolean hasAccess, String reason) {

    public static AccessDecision allow() {
        return new AccessDecision(true, null);
    }

    public static AccessDecision deny(String reason) {
        return new AccessDecision(false, reason);
    }
}
