package com.scoregate.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.scoregate.dto.TokenRequest;
import com.scoregate.dto.TokenResponse;
import com.scoregate.filter.ClientAddressResolver;
import com.scoregate.model.TokenIssueResult;
import com.scoregate.service.TokenIssuanceService;

import jakarta.servlet.http.HttpServletRequest;

@RestController
@RequestMapping("/api/v1/auth/token")
public class TokenController {

    private final TokenIssuanceService tokenIssuanceService;
    private final ClientAddressResolver clientAddressResolver;

    @Value("${scoregate.response.detailed:false}")
    private boolean detailedResponses;

    @Autowired
    public TokenController(TokenIssuanceService tokenIssuanceService, ClientAddressResolver clientAddressResolver) {
        this.tokenIssuanceService = tokenIssuanceService;
        this.clientAddressResolver = clientAddressResolver;
    }

    @PostMapping
    public ResponseEntity<TokenResponse> requestToken(@RequestBody TokenRequest tokenRequest,
            HttpServletRequest httpRequest) {
        TokenIssueResult result = tokenIssuanceService.issue(tokenRequest, clientAddressResolver.resolve(httpRequest));

        ResponseEntity.BodyBuilder response = ResponseEntity.status(result.outcome().status());
        if (result.retryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(result.retryAfterSeconds()));
        }
        if (result.issuedToken() != null) {
            return response.body(TokenResponse.issued(result.issuedToken().token(), result.expiresInSeconds(),
                    result.issuedToken().payload().exp()));
        }
        return response.body(TokenResponse.rejected(detailedResponses ? result.reason() : null,
                detailedResponses ? result.retryAfterSeconds() : null));
    }
}
