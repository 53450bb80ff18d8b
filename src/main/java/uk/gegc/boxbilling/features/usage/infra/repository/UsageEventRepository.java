package uk.gegc.boxbilling.features.usage.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.usage.domain.model.UsageEvent;

import java.util.UUID;

public interface UsageEventRepository extends JpaRepository<UsageEvent, UUID> {
}
