package com.scoregate.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.scoregate.client.LeaderboardGateway;
import com.scoregate.client.TicketValidator;
import com.scoregate.dto.AbilityStatRequest;
import com.scoregate.dto.ScoreSubmissionRequest;
import com.scoregate.dto.WeaponStatRequest;
import com.scoregate.exception.LeaderboardServiceException;
import com.scoregate.exception.StoreUnavailableException;
import com.scoregate.exception.SubmissionRejectedException;
import com.scoregate.model.AbilityStat;
import com.scoregate.model.AuditLogEntry;
import com.scoregate.model.Difficulty;
import com.scoregate.model.FailureCategory;
import com.scoregate.model.LeaderboardSubmitResult;
import com.scoregate.model.RateLimitDecision;
import com.scoregate.model.StatsCheckResult;
import com.scoregate.model.Submission;
import com.scoregate.model.SubmissionOutcome;
import com.scoregate.model.SubmissionResult;
import com.scoregate.model.SubmissionStage;
import com.scoregate.model.TicketValidation;
import com.scoregate.model.TokenPayload;
import com.scoregate.model.TokenVerification;
import com.scoregate.model.WeaponStat;

/**
 * Runs a score submission through the validation pipeline and forwards it to the
 * leaderboard. Gates run in {@link SubmissionStage} order; the first failing gate
 * decides the outcome. Every request produces exactly one audit entry.
 */
@Service
public class SubmissionOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(SubmissionOrchestrator.class);

    private final RateLimiterService rateLimiterService;
    private final TicketValidator ticketValidator;
    private final BanService banService;
    private final CapabilityTokenService tokenService;
    private final ReplayGuardService replayGuardService;
    private final StatsValidator statsValidator;
    private final MetadataPacker metadataPacker;
    private final LeaderboardGateway leaderboardGateway;
    private final AuditLogService auditLogService;
    private final Clock clock;

    @Value("${scoregate.rate-limit.submission.window-seconds:600}")
    private long windowSeconds = 600;

    @Value("${scoregate.rate-limit.submission.max-requests:3}")
    private long maxRequests = 3;

    @Value("${scoregate.policy.ban-on-implausible-stats:false}")
    private boolean banOnImplausibleStats;

    @Autowired
    public SubmissionOrchestrator(RateLimiterService rateLimiterService, TicketValidator ticketValidator,
            BanService banService, CapabilityTokenService tokenService, ReplayGuardService replayGuardService,
            StatsValidator statsValidator, MetadataPacker metadataPacker, LeaderboardGateway leaderboardGateway,
            AuditLogService auditLogService, Clock clock) {
        this.rateLimiterService = rateLimiterService;
        this.ticketValidator = ticketValidator;
        this.banService = banService;
        this.tokenService = tokenService;
        this.replayGuardService = replayGuardService;
        this.statsValidator = statsValidator;
        this.metadataPacker = metadataPacker;
        this.leaderboardGateway = leaderboardGateway;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    void setBanOnImplausibleStats(boolean banOnImplausibleStats) {
        this.banOnImplausibleStats = banOnImplausibleStats;
    }

    public SubmissionResult submit(ScoreSubmissionRequest request, String sourceAddress) {
        try {
            checkRateLimits(request.accountId(), sourceAddress);
            checkRequiredParameters(request);
            checkTicket(request.accountId(), request.ticket());
            checkNotBanned(request.accountId());
            Submission submission = toSubmission(request);
            TokenPayload payload = verifyToken(submission.token());
            checkTokenOwner(payload, submission.accountId());
            consumeToken(payload);
            checkStats(submission);
            LeaderboardSubmitResult leaderboardResult = forward(submission);

            logger.info("Score accepted: account {} | {} | {}ms | rank {} -> {}", submission.accountId(),
                    submission.difficulty(), submission.finalScore(), leaderboardResult.previousRank(),
                    leaderboardResult.newRank());
            audit(request, sourceAddress, SubmissionOutcome.SUCCESS);
            return SubmissionResult.success(leaderboardResult);
        } catch (SubmissionRejectedException e) {
            return reject(request, sourceAddress, e);
        }
    }

    private void checkRateLimits(String accountId, String sourceAddress) {
        List<String> keys = new ArrayList<>();
        keys.add("score:ip:" + sourceAddress);
        if (!isBlank(accountId)) {
            keys.add("score:account:" + accountId);
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

    private void checkRequiredParameters(ScoreSubmissionRequest request) {
        if (isBlank(request.accountId()) || isBlank(request.ticket())) {
            throw new SubmissionRejectedException(SubmissionOutcome.MISSING_PARAMETERS,
                    SubmissionStage.STRUCTURAL_CHECK, "accountId and ticket are required");
        }
    }

    private void checkTicket(String accountId, String ticket) {
        TicketValidation validation = ticketValidator.validate(accountId, ticket);
        if (!validation.valid()) {
            throw new SubmissionRejectedException(validation.failure().outcome(),
                    SubmissionStage.IDENTITY_TICKET_CHECK, validation.detail());
        }
    }

    private void checkNotBanned(String accountId) {
        if (banService.isBanned(accountId)) {
            throw new SubmissionRejectedException(SubmissionOutcome.BANNED, SubmissionStage.BAN_CHECK,
                    "Account is banned");
        }
    }

    /**
     * Converts the request into a {@link Submission}. Any missing field, including a
     * null list element, rejects the request naming every missing field.
     */
    Submission toSubmission(ScoreSubmissionRequest request) {
        List<String> missing = new ArrayList<>();
        if (isBlank(request.difficulty())) {
            missing.add("difficulty");
        }
        if (request.finalScore() == null) {
            missing.add("finalScore");
        }
        if (request.roundTimes() == null || request.roundTimes().contains(null)) {
            missing.add("roundTimes");
        }
        if (request.roundKills() == null || request.roundKills().contains(null)) {
            missing.add("roundKills");
        }
        if (request.weaponStats() == null || !request.weaponStats().stream().allMatch(this::isComplete)) {
            missing.add("weaponStats");
        }
        if (request.abilityStats() == null || !request.abilityStats().stream().allMatch(this::isComplete)) {
            missing.add("abilityStats");
        }
        if (isBlank(request.token())) {
            missing.add("token");
        }
        if (!missing.isEmpty()) {
            throw new SubmissionRejectedException(SubmissionOutcome.MISSING_FIELDS,
                    SubmissionStage.FIELD_COMPLETENESS_CHECK, "Missing fields: " + String.join(", ", missing));
        }

        List<WeaponStat> weapons = request.weaponStats().stream()
                .map(w -> new WeaponStat(w.name(), w.kills(), w.damage(), w.acquisitions()))
                .toList();
        List<AbilityStat> abilities = request.abilityStats().stream()
                .map(a -> new AbilityStat(a.name(), a.uses(), a.utility(), a.kills(), a.damage(), a.acquisitions()))
                .toList();
        return new Submission(request.accountId(), request.ticket(), request.difficulty(), request.finalScore(),
                request.roundTimes(), request.roundKills(), weapons, abilities, request.token());
    }

    private boolean isComplete(WeaponStatRequest stat) {
        return stat != null && !isBlank(stat.name()) && stat.kills() != null && stat.damage() != null;
    }

    private boolean isComplete(AbilityStatRequest stat) {
        return stat != null && !isBlank(stat.name()) && stat.uses() != null && stat.utility() != null;
    }

    private TokenPayload verifyToken(String token) {
        TokenVerification verification = tokenService.verify(token);
        if (!verification.valid()) {
            throw new SubmissionRejectedException(verification.failure().outcome(),
                    SubmissionStage.TOKEN_SIGNATURE_CHECK, "Token rejected: " + verification.failure());
        }
        return verification.payload();
    }

    private void checkTokenOwner(TokenPayload payload, String accountId) {
        if (!Objects.equals(payload.accountId(), accountId)) {
            throw new SubmissionRejectedException(SubmissionOutcome.TOKEN_OWNER_MISMATCH,
                    SubmissionStage.TOKEN_OWNER_MATCH_CHECK,
                    "Token issued to " + payload.accountId() + " presented by " + accountId);
        }
    }

    private void consumeToken(TokenPayload payload) {
        boolean firstUse;
        try {
            firstUse = replayGuardService.consume(payload);
        } catch (StoreUnavailableException e) {
            throw new SubmissionRejectedException(SubmissionOutcome.STORE_UNAVAILABLE,
                    SubmissionStage.TOKEN_REPLAY_CHECK, "Replay guard store unavailable", e);
        }
        if (!firstUse) {
            throw new SubmissionRejectedException(SubmissionOutcome.TOKEN_REPLAYED,
                    SubmissionStage.TOKEN_REPLAY_CHECK, "Token already used");
        }
    }

    private void checkStats(Submission submission) {
        StatsCheckResult result = statsValidator.validate(submission);
        if (!result.valid()) {
            throw new SubmissionRejectedException(SubmissionOutcome.INVALID_STATS, SubmissionStage.STATS_CHECK,
                    result.reason());
        }
    }

    /**
     * Uploads the score with packed statistics. If the leaderboard refuses the
     * metadata, the score is uploaded once more without it.
     */
    private LeaderboardSubmitResult forward(Submission submission) {
        Difficulty difficulty = Difficulty.fromTag(submission.difficulty())
                .orElseThrow(() -> new IllegalStateException("Unvalidated difficulty " + submission.difficulty()));
        int[] metadata = metadataPacker.pack(submission);
        try {
            return leaderboardGateway.submitScore(difficulty, submission.accountId(), submission.finalScore(),
                    metadata);
        } catch (LeaderboardServiceException e) {
            if (!e.isPayloadRejected()) {
                throw leaderboardError(e);
            }
            logger.warn("Leaderboard rejected metadata for {}, retrying without it: {}", submission.accountId(),
                    e.getMessage());
        }
        try {
            return leaderboardGateway.submitScore(difficulty, submission.accountId(), submission.finalScore(), null);
        } catch (LeaderboardServiceException e) {
            throw leaderboardError(e);
        }
    }

    private SubmissionRejectedException leaderboardError(LeaderboardServiceException e) {
        return new SubmissionRejectedException(SubmissionOutcome.LEADERBOARD_ERROR, SubmissionStage.PACK_AND_FORWARD,
                "Leaderboard upload failed: " + e.getMessage(), e);
    }

    private SubmissionResult reject(ScoreSubmissionRequest request, String sourceAddress,
            SubmissionRejectedException e) {
        SubmissionOutcome outcome = e.getOutcome();
        String reason = outcome.name() + ": " + e.getMessage();
        logger.warn("Submission rejected at {} [{}]: {} | account {} | IP {}", e.getStage(), outcome.category(),
                reason, request.accountId(), sourceAddress);

        boolean banned = outcome == SubmissionOutcome.BANNED;
        if (shouldBan(outcome) && !isBlank(request.accountId())) {
            banned = banService.ban(request.accountId(), sourceAddress, e.getStage() + " " + reason);
        }
        audit(request, sourceAddress, outcome);
        return SubmissionResult.rejected(outcome, banned, reason, e.getRetryAfterSeconds());
    }

    private boolean shouldBan(SubmissionOutcome outcome) {
        return outcome.isHard() || (outcome.category() == FailureCategory.PLAUSIBILITY && banOnImplausibleStats);
    }

    private void audit(ScoreSubmissionRequest request, String sourceAddress, SubmissionOutcome outcome) {
        auditLogService.record(new AuditLogEntry(clock.instant(), sourceAddress, request.accountId(),
                request.difficulty(), request.finalScore(), outcome == SubmissionOutcome.RATE_LIMITED,
                outcome.isSuccess(), outcome.name()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
