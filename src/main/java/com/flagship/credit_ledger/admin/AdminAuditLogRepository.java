package com.flagship.credit_ledger.admin;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AdminAuditLogRepository extends JpaRepository<AdminAuditLogEntity, UUID> {

    List<AdminAuditLogEntity> findByActionOrderByCreatedAtDesc(String action);

    List<AdminAuditLogEntity> findByTargetOrderByCreatedAtDesc(String target);
}
