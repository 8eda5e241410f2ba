package com.scoregate.client;

import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoregate.config.SteamProperties;
import com.scoregate.model.TicketFailure;
import com.scoregate.model.TicketValidation;

/**
 * Validates session tickets with {@code ISteamUserAuth/AuthenticateUserTicket/v1}.
 */
@Component
public class SteamTicketValidator implements TicketValidator {
    private static final Logger logger = LoggerFactory.getLogger(SteamTicketValidator.class);
    private static final String AUTH_PATH = "/ISteamUserAuth/AuthenticateUserTicket/v1/";

    private final RestTemplate restTemplate;
    private final SteamProperties steamProperties;
    private final ObjectMapper objectMapper;

    @Autowired
    public SteamTicketValidator(RestTemplate steamRestTemplate, SteamProperties steamProperties,
            ObjectMapper objectMapper) {
        this.restTemplate = steamRestTemplate;
        this.steamProperties = steamProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public TicketValidation validate(String accountId, String ticket) {
        URI uri = UriComponentsBuilder.fromHttpUrl(steamProperties.getAuthBaseUrl() + AUTH_PATH)
                .queryParam("key", steamProperties.getWebApiKey())
                .queryParam("appid", steamProperties.getAppId())
                .queryParam("ticket", ticket)
                .build()
                .encode()
                .toUri();
        try {
            String body = restTemplate.getForObject(uri, String.class);
            return interpret(accountId, body);
        } catch (RestClientException | JsonProcessingException e) {
            logger.error("Steam ticket validation error for account {}: {}", accountId, e.getMessage());
            return TicketValidation.fail(TicketFailure.VALIDATION_FAILED, e.getMessage());
        }
    }

    TicketValidation interpret(String accountId, String body) throws JsonProcessingException {
        if (body == null) {
            return TicketValidation.fail(TicketFailure.VALIDATION_FAILED, "Empty response");
        }
        JsonNode response = objectMapper.readTree(body).path("response");
        if (response.isMissingNode()) {
            return TicketValidation.fail(TicketFailure.VALIDATION_FAILED, "Unexpected response shape");
        }
        if (response.has("error")) {
            return TicketValidation.fail(TicketFailure.INVALID_TICKET,
                    response.path("error").path("errordesc").asText("Invalid ticket"));
        }

        String ticketAccountId = response.path("params").path("steamid").asText(null);
        if (ticketAccountId == null || !ticketAccountId.equals(accountId)) {
            return TicketValidation.fail(TicketFailure.IDENTITY_MISMATCH, "Ticket belongs to " + ticketAccountId);
        }

        String ownerAccountId = response.path("params").path("ownersteamid").asText(null);
        if (ownerAccountId != null && !ownerAccountId.isEmpty() && !ownerAccountId.equals(accountId)) {
            return TicketValidation.fail(TicketFailure.NOT_ENTITLED, "Application owned by " + ownerAccountId);
        }
        return TicketValidation.ok();
    }
}
