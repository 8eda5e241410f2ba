package com.scoregate.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class BanAdminControllerTest {
    private static final String ADMIN_KEY = "test-admin-key";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void requestsWithoutKeyAreForbidden() throws Exception {
        mockMvc.perform(get("/api/v1/admin/bans/76561198000002001"))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/v1/admin/bans/76561198000002001").header("X-Admin-Key", "wrong"))
                .andExpect(status().isForbidden());
    }

    @Test
    void banLookupAndUnban() throws Exception {
        String account = "76561198000002002";

        mockMvc.perform(post("/api/v1/admin/bans").header("X-Admin-Key", ADMIN_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accountId\":\"" + account + "\",\"reason\":\"chargeback abuse\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.accountId").value(account))
                .andExpect(jsonPath("$.reason").value("MANUAL: chargeback abuse"));

        mockMvc.perform(get("/api/v1/admin/bans/" + account).header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/v1/admin/bans/" + account).header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/admin/bans/" + account).header("X-Admin-Key", ADMIN_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BAN_NOT_FOUND"));
    }

    @Test
    void banRequestWithoutReasonIsInvalid() throws Exception {
        mockMvc.perform(post("/api/v1/admin/bans").header("X-Admin-Key", ADMIN_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accountId\":\"76561198000002003\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }
}
