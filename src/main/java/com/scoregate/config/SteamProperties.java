package com.scoregate.config;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.scoregate.model.Difficulty;

/**
 * Steam Web API settings: credentials, endpoints, timeouts and the leaderboard id
 * of each difficulty.
 */
@ConfigurationProperties(prefix = "scoregate.steam")
public class SteamProperties {

    private String webApiKey;
    private String appId;
    private String authBaseUrl = "https://api.steampowered.com";
    private String partnerBaseUrl = "https://partner.steam-api.com";
    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(6);
    /** EResult returned by SetLeaderboardScore when the details blob is malformed or too large. */
    private int payloadRejectedResult = 8;
    private Map<Difficulty, String> leaderboardIds = new EnumMap<>(Difficulty.class);

    public String getWebApiKey() {
        return webApiKey;
    }

    public void setWebApiKey(String webApiKey) {
        this.webApiKey = webApiKey;
    }

    public String getAppId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
    }

    public String getAuthBaseUrl() {
        return authBaseUrl;
    }

    public void setAuthBaseUrl(String authBaseUrl) {
        this.authBaseUrl = authBaseUrl;
    }

    public String getPartnerBaseUrl() {
        return partnerBaseUrl;
    }

    public void setPartnerBaseUrl(String partnerBaseUrl) {
        this.partnerBaseUrl = partnerBaseUrl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getPayloadRejectedResult() {
        return payloadRejectedResult;
    }

    public void setPayloadRejectedResult(int payloadRejectedResult) {
        this.payloadRejectedResult = payloadRejectedResult;
    }

    public Map<Difficulty, String> getLeaderboardIds() {
        return leaderboardIds;
    }

    public void setLeaderboardIds(Map<Difficulty, String> leaderboardIds) {
        this.leaderboardIds = leaderboardIds;
    }
}
