package com.scoregate.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.scoregate.dto.ScoreSubmissionRequest;
import com.scoregate.dto.SubmissionResponse;
import com.scoregate.filter.ClientAddressResolver;
import com.scoregate.model.SubmissionResult;
import com.scoregate.service.SubmissionOrchestrator;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Score submission endpoint used by the game client at the end of a run.
 */
@RestController
@RequestMapping("/api/v1/scores")
public class ScoreController {

    private final SubmissionOrchestrator submissionOrchestrator;
    private final ClientAddressResolver clientAddressResolver;

    @Value("${scoregate.response.detailed:false}")
    private boolean detailedResponses;

    @Autowired
    public ScoreController(SubmissionOrchestrator submissionOrchestrator,
            ClientAddressResolver clientAddressResolver) {
        this.submissionOrchestrator = submissionOrchestrator;
        this.clientAddressResolver = clientAddressResolver;
    }

    /**
     * Submits a run. The status code reflects the outcome; the body always carries
     * the acceptance and ban flags.
     */
    @PostMapping
    public ResponseEntity<SubmissionResponse> submitScore(@RequestBody ScoreSubmissionRequest submissionRequest,
            HttpServletRequest httpRequest) {
        SubmissionResult result = submissionOrchestrator.submit(submissionRequest,
                clientAddressResolver.resolve(httpRequest));

        SubmissionResponse body = new SubmissionResponse(result.accepted(), result.scoreChanged(),
                result.previousRank(), result.newRank(), result.banned(),
                detailedResponses ? result.reason() : null,
                detailedResponses ? result.retryAfterSeconds() : null);
        ResponseEntity.BodyBuilder response = ResponseEntity.status(result.outcome().status());
        if (result.retryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds()));
        }
        return response.body(body);
    }
}
