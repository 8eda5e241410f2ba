package com.scoregate.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.scoregate.client.TicketValidator;
import com.scoregate.dto.TokenRequest;
import com.scoregate.model.AuditLogEntry;
import com.scoregate.model.SubmissionOutcome;
import com.scoregate.model.TicketFailure;
import com.scoregate.model.TicketValidation;
import com.scoregate.model.TokenIssueResult;
import com.scoregate.store.InMemoryCounterStore;
import com.scoregate.support.MutableClock;

@ExtendWith(MockitoExtension.class)
class TokenIssuanceServiceTest {
    private static final String ACCOUNT = "76561198000000001";
    private static final String ADDRESS = "198.51.100.4";

    @Mock
    private TicketValidator ticketValidator;

    @Mock
    private BanService banService;

    @Mock
    private AuditLogService auditLogService;

    private CapabilityTokenService tokenService;
    private TokenIssuanceService issuanceService;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        tokenService = new CapabilityTokenService("0123456789abcdef0123456789abcdef", 30, clock);
        issuanceService = new TokenIssuanceService(new RateLimiterService(new InMemoryCounterStore(clock), clock),
                ticketValidator, banService, tokenService, auditLogService, clock);
    }

    @Test
    void issuesVerifiableTokenForValidTicket() {
        when(ticketValidator.validate(ACCOUNT, "ticket")).thenReturn(TicketValidation.ok());

        TokenIssueResult result = issuanceService.issue(new TokenRequest(ACCOUNT, "ticket"), ADDRESS);

        assertThat(result.outcome()).isEqualTo(SubmissionOutcome.SUCCESS);
        assertThat(result.expiresInSeconds()).isEqualTo(30);
        assertThat(tokenService.verify(result.issuedToken().token()).payload().accountId()).isEqualTo(ACCOUNT);
        assertAudited("TOKEN_SUCCESS");
    }

    @Test
    void missingTicketIsRejectedBeforeValidation() {
        TokenIssueResult result = issuanceService.issue(new TokenRequest(ACCOUNT, " "), ADDRESS);

        assertThat(result.outcome()).isEqualTo(SubmissionOutcome.MISSING_PARAMETERS);
        verify(ticketValidator, never()).validate(anyString(), anyString());
        verify(banService, never()).ban(anyString(), anyString(), anyString());
    }

    @Test
    void bannedAccountGetsNoToken() {
        when(banService.isBanned(ACCOUNT)).thenReturn(true);

        TokenIssueResult result = issuanceService.issue(new TokenRequest(ACCOUNT, "ticket"), ADDRESS);

        assertThat(result.outcome()).isEqualTo(SubmissionOutcome.BANNED);
        assertThat(result.issuedToken()).isNull();
        verify(ticketValidator, never()).validate(anyString(), anyString());
    }

    @Test
    void identityMismatchBans() {
        when(ticketValidator.validate(ACCOUNT, "ticket"))
                .thenReturn(TicketValidation.fail(TicketFailure.IDENTITY_MISMATCH, "Ticket belongs to someone else"));

        TokenIssueResult result = issuanceService.issue(new TokenRequest(ACCOUNT, "ticket"), ADDRESS);

        assertThat(result.outcome()).isEqualTo(SubmissionOutcome.IDENTITY_MISMATCH);
        verify(banService).ban(eq(ACCOUNT), eq(ADDRESS), anyString());
        assertAudited("TOKEN_IDENTITY_MISMATCH");
    }

    @Test
    void inconclusiveValidationDoesNotBan() {
        when(ticketValidator.validate(ACCOUNT, "ticket"))
                .thenReturn(TicketValidation.fail(TicketFailure.VALIDATION_FAILED, "timed out"));

        TokenIssueResult result = issuanceService.issue(new TokenRequest(ACCOUNT, "ticket"), ADDRESS);

        assertThat(result.outcome().status().value()).isEqualTo(503);
        verify(banService, never()).ban(anyString(), anyString(), anyString());
    }

    @Test
    void fourthRequestFromAddressIsRateLimited() {
        when(ticketValidator.validate(anyString(), anyString())).thenReturn(TicketValidation.ok());
        for (int i = 0; i < 3; i++) {
            issuanceService.issue(new TokenRequest("acct-" + i, "ticket"), ADDRESS);
        }

        TokenIssueResult result = issuanceService.issue(new TokenRequest("acct-9", "ticket"), ADDRESS);

        assertThat(result.outcome()).isEqualTo(SubmissionOutcome.RATE_LIMITED);
        assertThat(result.retryAfterSeconds()).isPositive();
    }

    private void assertAudited(String outcome) {
        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(auditLogService).record(captor.capture());
        assertThat(captor.getValue().outcome()).isEqualTo(outcome);
    }
}
