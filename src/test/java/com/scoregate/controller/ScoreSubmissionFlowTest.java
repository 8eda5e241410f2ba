package com.scoregate.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoregate.client.LocalLeaderboardGateway;
import com.scoregate.client.TicketValidator;
import com.scoregate.dto.TokenRequest;
import com.scoregate.model.Difficulty;
import com.scoregate.model.MetadataLayout;
import com.scoregate.model.TicketValidation;
import com.scoregate.repository.AuditLogRepository;
import com.scoregate.service.BanService;
import com.scoregate.support.Submissions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ScoreSubmissionFlowTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AuditLogRepository auditLogRepository;

    @Autowired
    private BanService banService;

    @Autowired
    private LocalLeaderboardGateway leaderboardGateway;

    @MockBean
    private TicketValidator ticketValidator;

    @BeforeEach
    void setUp() {
        when(ticketValidator.validate(anyString(), anyString())).thenReturn(TicketValidation.ok());
    }

    @Test
    void validRunIsAcceptedAndAuditedOnce() throws Exception {
        String account = "76561198000001001";
        String token = requestToken(account, "192.0.2.1");

        mockMvc.perform(post("/api/v1/scores")
                .header("X-Forwarded-For", "192.0.2.1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Submissions.request(account, token))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.banned").value(false))
                .andExpect(jsonPath("$.newRank").value(1));

        assertThat(auditLogRepository.findOutcomesByAccountId(account)).containsExactly("TOKEN_SUCCESS", "SUCCESS");
        int[] metadata = leaderboardGateway.getMetadata(Difficulty.HARD, account);
        assertThat(metadata).hasSize(MetadataLayout.CAPACITY);
        assertThat(metadata[MetadataLayout.SUMMARY_FINAL_SCORE]).isEqualTo((int) Submissions.FINAL_SCORE);
    }

    @Test
    void replayedTokenBansAccount() throws Exception {
        String account = "76561198000001002";
        String token = requestToken(account, "192.0.2.2");
        String body = objectMapper.writeValueAsString(Submissions.request(account, token));

        mockMvc.perform(post("/api/v1/scores").header("X-Forwarded-For", "192.0.2.2")
                .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/scores").header("X-Forwarded-For", "192.0.2.2")
                .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.accepted").value(false))
                .andExpect(jsonPath("$.banned").value(true))
                .andExpect(jsonPath("$.reason").value(startsWith("TOKEN_REPLAYED")));

        assertThat(banService.isBanned(account)).isTrue();
        assertThat(leaderboardGateway.getLeaderboard(Difficulty.HARD).getRank(account)).isZero();
        assertThat(auditLogRepository.findOutcomesByAccountId(account)).endsWith("TOKEN_REPLAYED");
    }

    @Test
    void oversizedForwardedHeaderStillBansReplayedToken() throws Exception {
        String account = "76561198000001006";
        String token = requestToken(account, "192.0.2.6");
        String body = objectMapper.writeValueAsString(Submissions.request(account, token));
        String oversized = "1234567890".repeat(6);

        mockMvc.perform(post("/api/v1/scores").header("X-Forwarded-For", oversized)
                .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/scores").header("X-Forwarded-For", oversized)
                .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.banned").value(true))
                .andExpect(jsonPath("$.reason").value(startsWith("TOKEN_REPLAYED")));

        assertThat(banService.isBanned(account)).isTrue();
        assertThat(auditLogRepository.findOutcomesByAccountId(account)).contains("SUCCESS", "TOKEN_REPLAYED");
    }

    @Test
    void submissionWithoutIdentityIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/scores").header("X-Forwarded-For", "192.0.2.3")
                .contentType(MediaType.APPLICATION_JSON).content("{\"difficulty\":\"easy\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.banned").value(false));
    }

    @Test
    void malformedJsonIsRejectedByAdvice() throws Exception {
        mockMvc.perform(post("/api/v1/scores").header("X-Forwarded-For", "192.0.2.4")
                .contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void tokenEndpointIsRateLimitedWithRetryAfter() throws Exception {
        String body = objectMapper.writeValueAsString(new TokenRequest("76561198000001005", "ticket"));
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(post("/api/v1/auth/token").header("X-Forwarded-For", "192.0.2.5")
                    .contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(post("/api/v1/auth/token").header("X-Forwarded-For", "192.0.2.5")
                .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.token").doesNotExist());
    }

    private String requestToken(String account, String address) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/auth/token")
                .header("X-Forwarded-For", address)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new TokenRequest(account, "ticket"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.expiresIn").value(30))
                .andReturn();
        JsonNode response = objectMapper.readTree(result.getResponse().getContentAsString());
        return response.path("token").asText();
    }
}
