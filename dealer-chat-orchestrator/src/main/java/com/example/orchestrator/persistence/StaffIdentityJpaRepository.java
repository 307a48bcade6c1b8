package com.example.orchestrator.persistence;

import com.example.orchestrator.domain.StaffRole;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffIdentityJpaRepository extends JpaRepository<StaffIdentityEntity, String> {

    @Query(
            "select s from StaffIdentityEntity s "
                    + "where s.active = true "
                    + "and s.phone is not null "
                    + "and (s.tenantId = :tenantId or s.tenantId is null)")
    List<StaffIdentityEntity> findCandidates(@Param("tenantId") String tenantId);

    List<StaffIdentityEntity> findByTenantIdAndRoleInAndActiveTrue(String tenantId, Collection<StaffRole> roles);
}
