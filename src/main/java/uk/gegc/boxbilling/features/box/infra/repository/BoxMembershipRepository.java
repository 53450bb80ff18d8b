package uk.gegc.boxbilling.features.box.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.boxbilling.features.box.domain.model.BoxMembership;
import uk.gegc.boxbilling.features.box.domain.model.MembershipRole;

import java.util.Collection;
import java.util.UUID;

public interface BoxMembershipRepository extends JpaRepository<BoxMembership, UUID> {

    long countByBoxIdAndActiveTrueAndRoleIn(UUID boxId, Collection<MembershipRole> roles);
}
