package com.scoregate.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.scoregate.model.AuditLogEntry;
import com.scoregate.repository.AuditLogRepository;

/**
 * Fire-and-forget audit trail. Writes run on the audit executor; the caller never
 * waits for them and a failed write is logged and dropped.
 */
@Service
public class AuditLogService {
    private static final Logger logger = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final Executor auditExecutor;

    @Autowired
    public AuditLogService(AuditLogRepository auditLogRepository, @Qualifier("auditExecutor") Executor auditExecutor) {
        this.auditLogRepository = auditLogRepository;
        this.auditExecutor = auditExecutor;
    }

    public void record(AuditLogEntry entry) {
        try {
            CompletableFuture.runAsync(() -> auditLogRepository.insert(entry), auditExecutor)
                    .exceptionally(e -> {
                        logger.error("Error writing audit entry {} for {}: {}", entry.outcome(), entry.accountId(),
                                e.getMessage());
                        return null;
                    });
        } catch (RuntimeException e) {
            logger.error("Could not schedule audit entry {} for {}", entry.outcome(), entry.accountId(), e);
        }
    }
}
