package com.scoregate.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.scoregate.client.TicketValidator;
import com.scoregate.dto.TokenRequest;
import com.scoregate.exception.StoreUnavailableException;
import com.scoregate.exception.SubmissionRejectedException;
import com.scoregate.model.AuditLogEntry;
import com.scoregate.model.IssuedToken;
import com.scoregate.model.RateLimitDecision;
import com.scoregate.model.SubmissionOutcome;
import com.scoregate.model.SubmissionStage;
import com.scoregate.model.TicketValidation;
import com.scoregate.model.TokenIssueResult;

/**
 * Issues a capability token to a player whose identity ticket checks out.
 * The client asks for one right before submitting a run.
 */
@Service
public class TokenIssuanceService {
    private static final Logger logger = LoggerFactory.getLogger(TokenIssuanceService.class);
    private static final String AUDIT_PREFIX = "TOKEN_";

    private final RateLimiterService rateLimiterService;
    private final TicketValidator ticketValidator;
    private final BanService banService;
    private final CapabilityTokenService tokenService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Value("${scoregate.rate-limit.token.window-seconds:600}")
    private long windowSeconds = 600;

    @Value("${scoregate.rate-limit.token.max-requests:3}")
    private long maxRequests = 3;

    @Autowired
    public TokenIssuanceService(RateLimiterService rateLimiterService, TicketValidator ticketValidator,
            BanService banService, CapabilityTokenService tokenService, AuditLogService auditLogService,
            Clock clock) {
        this.rateLimiterService = rateLimiterService;
        this.ticketValidator = ticketValidator;
        this.banService = banService;
        this.tokenService = tokenService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public TokenIssueResult issue(TokenRequest request, String sourceAddress) {
        try {
            checkRateLimits(request.accountId(), sourceAddress);
            if (isBlank(request.accountId()) || isBlank(request.ticket())) {
                throw new SubmissionRejectedException(SubmissionOutcome.MISSING_PARAMETERS,
                        SubmissionStage.STRUCTURAL_CHECK, "accountId and ticket are required");
            }
            if (banService.isBanned(request.accountId())) {
                throw new SubmissionRejectedException(SubmissionOutcome.BANNED, SubmissionStage.BAN_CHECK,
                        "Account is banned");
            }
            TicketValidation validation = ticketValidator.validate(request.accountId(), request.ticket());
            if (!validation.valid()) {
                throw new SubmissionRejectedException(validation.failure().outcome(),
                        SubmissionStage.IDENTITY_TICKET_CHECK, validation.detail());
            }

            IssuedToken issued = tokenService.issue(request.accountId());
            logger.info("Token issued to account {} from {}", request.accountId(), sourceAddress);
            audit(request, sourceAddress, SubmissionOutcome.SUCCESS);
            return TokenIssueResult.issued(issued, tokenService.getTtlSeconds());
        } catch (SubmissionRejectedException e) {
            return reject(request, sourceAddress, e);
        }
    }

    private void checkRateLimits(String accountId, String sourceAddress) {
        List<String> keys = new ArrayList<>();
        keys.add("token:ip:" + sourceAddress);
        if (!isBlank(accountId)) {
            keys.add("token:account:" + accountId);
        }
        RateLimitDecision decision;
        try {
            decision = rateLimiterService.checkAll(keys, windowSeconds, maxRequests);
        } catch (StoreUnavailableException e) {
            throw new SubmissionRejectedException(SubmissionOutcome.STORE_UNAVAILABLE, SubmissionStage.RATE_CHECK,
                    "Rate limit store unavailable", e);
        }
        if (decision.limited()) {
            throw SubmissionRejectedException.rateLimited(SubmissionStage.RATE_CHECK, decision.retryAfterSeconds());
        }
    }

    private TokenIssueResult reject(TokenRequest request, String sourceAddress, SubmissionRejectedException e) {
        SubmissionOutcome outcome = e.getOutcome();
        String reason = outcome.name() + ": " + e.getMessage();
        logger.warn("Token request rejected at {} [{}]: {} | account {} | IP {}", e.getStage(), outcome.category(),
                reason, request.accountId(), sourceAddress);
        if (outcome.isHard() && !isBlank(request.accountId())) {
            banService.ban(request.accountId(), sourceAddress, "TOKEN_" + e.getStage() + " " + reason);
        }
        audit(request, sourceAddress, outcome);
        return TokenIssueResult.rejected(outcome, reason, e.getRetryAfterSeconds());
    }

    private void audit(TokenRequest request, String sourceAddress, SubmissionOutcome outcome) {
        auditLogService.record(new AuditLogEntry(clock.instant(), sourceAddress, request.accountId(), null, null,
                outcome == SubmissionOutcome.RATE_LIMITED, outcome.isSuccess(), AUDIT_PREFIX + outcome.name()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
