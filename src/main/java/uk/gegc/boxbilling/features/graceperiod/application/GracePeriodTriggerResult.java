package uk.gegc.boxbilling.features.graceperiod.application;

import uk.gegc.boxbilling.features.graceperiod.domain.model.GracePeriod;

public record GracePeriodTriggerResult(GracePeriod gracePeriod, boolean wasExisting) {
}
