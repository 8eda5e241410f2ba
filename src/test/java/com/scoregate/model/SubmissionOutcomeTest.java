package com.scoregate.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class SubmissionOutcomeTest {

    @Test
    void everyRejectionCarriesACategory() {
        assertThat(SubmissionOutcome.values())
                .filteredOn(outcome -> outcome != SubmissionOutcome.SUCCESS)
                .allSatisfy(outcome -> assertThat(outcome.category()).isNotNull());
    }

    @Test
    void transientAndUpstreamFailuresAreNeverHard() {
        assertThat(SubmissionOutcome.values())
                .filteredOn(outcome -> outcome.category() == FailureCategory.TRANSIENT
                        || outcome.category() == FailureCategory.UPSTREAM)
                .noneMatch(SubmissionOutcome::isHard);
    }

    @Test
    void onlyImplausibleStatsArePlausibilityFailures() {
        assertThat(Arrays.stream(SubmissionOutcome.values())
                .filter(outcome -> outcome.category() == FailureCategory.PLAUSIBILITY))
                .containsExactly(SubmissionOutcome.INVALID_STATS);
    }

    @Test
    void inconclusiveTicketValidationIsTheOnlySoftTicketFailure() {
        assertThat(TicketFailure.values())
                .filteredOn(failure -> !failure.outcome().isHard())
                .containsExactly(TicketFailure.VALIDATION_FAILED);
    }
}
