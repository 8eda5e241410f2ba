package com.scoregate.client;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.HexFormat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoregate.config.SteamProperties;
import com.scoregate.exception.LeaderboardServiceException;
import com.scoregate.model.Difficulty;
import com.scoregate.model.LeaderboardSubmitResult;

/**
 * Steam partner leaderboard client ({@code ISteamLeaderboards}).
 * The metadata blob is sent as the {@code details} field: each slot as a
 * little-endian int32, hex encoded.
 */
@Component
@ConditionalOnProperty(name = "scoregate.leaderboard.mode", havingValue = "steam")
public class SteamLeaderboardGateway implements LeaderboardGateway {
    private static final Logger logger = LoggerFactory.getLogger(SteamLeaderboardGateway.class);
    private static final String SET_SCORE_PATH = "/ISteamLeaderboards/SetLeaderboardScore/v1/";
    private static final String DELETE_SCORE_PATH = "/ISteamLeaderboards/DeleteLeaderboardScore/v1/";
    private static final String SCORE_METHOD_KEEP_BEST = "KeepBest";
    private static final int RESULT_OK = 1;

    private final RestTemplate restTemplate;
    private final SteamProperties steamProperties;
    private final ObjectMapper objectMapper;

    @Autowired
    public SteamLeaderboardGateway(RestTemplate steamRestTemplate, SteamProperties steamProperties,
            ObjectMapper objectMapper) {
        this.restTemplate = steamRestTemplate;
        this.steamProperties = steamProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public LeaderboardSubmitResult submitScore(Difficulty difficulty, String accountId, long score, int[] metadata) {
        MultiValueMap<String, String> form = baseForm(difficulty, accountId);
        form.add("score", Long.toString(score));
        form.add("scoremethod", SCORE_METHOD_KEEP_BEST);
        if (metadata != null) {
            form.add("details", encodeDetails(metadata));
        }

        String body;
        try {
            body = post(SET_SCORE_PATH, form);
        } catch (HttpClientErrorException.BadRequest e) {
            if (metadata != null) {
                throw LeaderboardServiceException.payloadRejected("Leaderboard rejected the upload: " + e.getStatusText());
            }
            throw new LeaderboardServiceException("Leaderboard rejected the upload", e);
        } catch (RestClientException e) {
            throw new LeaderboardServiceException("Leaderboard upload failed", e);
        }
        return interpretSubmit(body, metadata != null);
    }

    @Override
    public void deleteEntry(Difficulty difficulty, String accountId) {
        try {
            post(DELETE_SCORE_PATH, baseForm(difficulty, accountId));
        } catch (RestClientException e) {
            throw new LeaderboardServiceException("Failed to delete " + accountId + " from " + difficulty, e);
        }
    }

    LeaderboardSubmitResult interpretSubmit(String body, boolean hadMetadata) {
        JsonNode result;
        try {
            result = objectMapper.readTree(body == null ? "{}" : body).path("result");
        } catch (JsonProcessingException e) {
            throw new LeaderboardServiceException("Unreadable leaderboard response", e);
        }
        int resultCode = result.path("result").asInt(0);
        if (resultCode != RESULT_OK) {
            if (hadMetadata && resultCode == steamProperties.getPayloadRejectedResult()) {
                throw LeaderboardServiceException.payloadRejected("Leaderboard rejected the details payload");
            }
            throw new LeaderboardServiceException("Leaderboard returned result " + resultCode);
        }
        return new LeaderboardSubmitResult(
                true,
                result.path("score_changed").asBoolean(false),
                result.path("global_rank_previous").asInt(0),
                result.path("global_rank_new").asInt(0));
    }

    static String encodeDetails(int[] metadata) {
        ByteBuffer buffer = ByteBuffer.allocate(metadata.length * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int slot : metadata) {
            buffer.putInt(slot);
        }
        return HexFormat.of().formatHex(buffer.array());
    }

    private MultiValueMap<String, String> baseForm(Difficulty difficulty, String accountId) {
        String leaderboardId = steamProperties.getLeaderboardIds().get(difficulty);
        if (leaderboardId == null || leaderboardId.isBlank()) {
            throw new LeaderboardServiceException("No leaderboard configured for " + difficulty);
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("key", steamProperties.getWebApiKey());
        form.add("appid", steamProperties.getAppId());
        form.add("leaderboardid", leaderboardId);
        form.add("steamid", accountId);
        return form;
    }

    private String post(String path, MultiValueMap<String, String> form) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        String body = restTemplate.postForObject(steamProperties.getPartnerBaseUrl() + path,
                new HttpEntity<>(form, headers), String.class);
        logger.debug("Steam {} response: {}", path, body);
        return body;
    }
}
