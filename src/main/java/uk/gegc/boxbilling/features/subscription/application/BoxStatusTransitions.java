package uk.gegc.boxbilling.features.subscription.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.boxbilling.features.box.domain.model.Box;
import uk.gegc.boxbilling.features.box.domain.model.BoxStatus;

/**
 * The only place that writes {@link Box#getStatus()}.
 *
 * <p>The webhook handlers, the reconciliation sweep and the access check all go through these
 * methods, so whichever of them wins a race leaves the box in one of the same target states.
 * Each method returns {@code true} when the status actually changed; the caller owns the
 * transaction that persists the box.</p>
 */
@Slf4j
@Component
public class BoxStatusTransitions {

    public boolean activate(Box box) {
        return moveTo(box, BoxStatus.ACTIVE);
    }

    public boolean suspend(Box box) {
        return moveTo(box, BoxStatus.SUSPENDED);
    }

    public boolean markTrialExpired(Box box) {
        return moveTo(box, BoxStatus.TRIAL_EXPIRED);
    }

    public boolean markPaymentFailed(Box box) {
        return moveTo(box, BoxStatus.PAYMENT_FAILED);
    }

    private boolean moveTo(Box box, BoxStatus target) {
        BoxStatus current = box.getStatus();
        if (current == target) {
            return false;
        }
        box.setStatus(target);
        log.info("Box {} status {} -> {}", box.getId(), current == null ? null : current.getValue(), target.getValue());
        return true;
    }
}
