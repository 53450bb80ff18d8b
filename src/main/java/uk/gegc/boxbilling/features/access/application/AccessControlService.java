package uk.gegc.boxbilling.features.access.application;

import java.util.UUID;

/**
 * Answers whether a box may use the product right now. Denials are returned, never thrown.
 */
public interface AccessControlService {

    /**
     * Decide from persisted state. An expired trial without a subscription is moved to
     * {@code trial_expired} as part of the check.
     */
    AccessDecision checkAccess(UUID boxId);

    /**
     * Base access plus the feature's own gate (member limits or plan tier).
     *
     * @param feature one of {@code add_athlete}, {@code add_coach}, {@code advanced_analytics}, {@code api_access}
     */
    AccessDecision checkFeatureAccess(UUID boxId, String feature);
}
