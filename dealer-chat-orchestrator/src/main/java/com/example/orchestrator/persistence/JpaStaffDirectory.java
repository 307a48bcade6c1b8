package com.example.orchestrator.persistence;

import com.example.orchestrator.domain.StaffIdentity;
import com.example.orchestrator.domain.StaffRole;
import com.example.orchestrator.identity.StaffDirectory;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaStaffDirectory implements StaffDirectory {

    private final StaffIdentityJpaRepository staffIdentityJpaRepository;

    @Override
    @Transactional(readOnly = true)
    public List<StaffIdentity> findCandidates(String tenantId) {
        return staffIdentityJpaRepository.findCandidates(tenantId).stream()
                .map(this::toIdentity)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<StaffIdentity> findByRoles(String tenantId, Collection<StaffRole> roles) {
        if (!StringUtils.hasText(tenantId) || CollectionUtils.isEmpty(roles)) {
            return Collections.emptyList();
        }
        return staffIdentityJpaRepository.findByTenantIdAndRoleInAndActiveTrue(tenantId, roles).stream()
                .map(this::toIdentity)
                .toList();
    }

    private StaffIdentity toIdentity(StaffIdentityEntity entity) {
        return StaffIdentity.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .firstName(entity.getFirstName())
                .lastName(entity.getLastName())
                .phone(entity.getPhone())
                .role(entity.getRole())
                .roleLevel(entity.getRoleLevel())
                .build();
    }
}
