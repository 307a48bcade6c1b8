package com.example.orchestrator.persistence;

import com.example.orchestrator.domain.ConversationStatus;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConversationJpaRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findByTenantIdAndCustomerPhone(String tenantId, String customerPhone);

    List<ConversationEntity> findByTenantIdOrderByLastMessageAtDesc(String tenantId);

    List<ConversationEntity> findByTenantIdAndStatusOrderByLastMessageAtDesc(String tenantId, ConversationStatus status);

    @Query(
            "select c from ConversationEntity c "
                    + "where c.tenantId = :tenantId "
                    + "and c.contextData like concat('%', :lid, '%')")
    List<ConversationEntity> findContextMentioning(@Param("tenantId") String tenantId, @Param("lid") String lid);
}
