package uk.gegc.boxbilling.features.subscription.application;

/**
 * Daily safety net that brings box status in line with time-based facts the webhooks cannot deliver:
 * trials running out and scheduled cancellations taking effect.
 */
public interface SubscriptionEnforcementService {

    /**
     * Expire lapsed trials and suspend boxes whose canceled subscription has ended. Never opens grace
     * periods; a second run right after the first changes nothing.
     */
    EnforcementSummary enforceSubscriptionRules();
}
