package uk.gegc.boxbilling.features.billing.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.boxbilling.features.billing.application.event.BillingEventPayloads;
import uk.gegc.boxbilling.features.billing.application.event.NormalizedBillingEvent;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.infra.repository.BoxRepository;
import uk.gegc.boxbilling.features.subscription.domain.model.Subscription;
import uk.gegc.boxbilling.features.subscription.infra.repository.SubscriptionRepository;
import uk.gegc.boxbilling.shared.exception.ResourceNotFoundException;
import uk.gegc.boxbilling.shared.exception.ValidationException;

import java.util.Optional;
import java.util.UUID;

/**
 * Works out which box a webhook event belongs to: envelope metadata, then the metadata echoed in the
 * entity, then the linked subscription, then the linked customer.
 */
@Component
@RequiredArgsConstructor
public class BoxResolver {

    private final BoxRepository boxRepository;
    private final SubscriptionRepository subscriptionRepository;

    public UUID resolve(NormalizedBillingEvent event, String providerSubscriptionId, String providerCustomerId) {
        String explicit = event.metadata() != null ? event.metadata().boxId() : null;
        if (explicit == null) {
            explicit = BillingEventPayloads.metadataBoxId(event.data());
        }
        if (explicit != null) {
            return parse(explicit);
        }

        if (providerSubscriptionId != null) {
            Optional<UUID> bySubscription = boxRepository.findByProviderSubscriptionId(providerSubscriptionId)
                    .map(Box::getId)
                    .or(() -> subscriptionRepository.findByProviderSubscriptionId(providerSubscriptionId)
                            .map(Subscription::getBoxId));
            if (bySubscription.isPresent()) {
                return bySubscription.get();
            }
        }
        if (providerCustomerId != null) {
            Optional<UUID> byCustomer = boxRepository.findFirstByProviderCustomerId(providerCustomerId).map(Box::getId);
            if (byCustomer.isPresent()) {
                return byCustomer.get();
            }
        }
        throw new ResourceNotFoundException("No box found for event " + event.id());
    }

    public static UUID parse(String boxId) {
        try {
            return UUID.fromString(boxId.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid box id '" + boxId + "'");
        }
    }
}
