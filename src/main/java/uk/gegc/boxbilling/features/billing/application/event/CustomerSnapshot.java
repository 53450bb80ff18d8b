package uk.gegc.boxbilling.features.billing.application.event;

public record CustomerSnapshot(String providerCustomerId, String email, String name) {
}
