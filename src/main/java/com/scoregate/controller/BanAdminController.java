package com.scoregate.controller;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.scoregate.dto.BanRequest;
import com.scoregate.dto.BanResponse;
import com.scoregate.exception.AdminAccessDeniedException;
import com.scoregate.exception.StoreUnavailableException;
import com.scoregate.filter.ClientAddressResolver;
import com.scoregate.service.BanService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

/**
 * Operator endpoints for managing bans.
 * Every call must carry {@code X-Admin-Key}; with no key configured the endpoints are closed.
 */
@RestController
@RequestMapping("/api/v1/admin/bans")
public class BanAdminController {
    static final String ADMIN_KEY_HEADER = "X-Admin-Key";

    private final BanService banService;
    private final ClientAddressResolver clientAddressResolver;

    @Value("${scoregate.admin.api-key:}")
    private String adminApiKey;

    @Autowired
    public BanAdminController(BanService banService, ClientAddressResolver clientAddressResolver) {
        this.banService = banService;
        this.clientAddressResolver = clientAddressResolver;
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<BanResponse> getBan(@RequestHeader(value = ADMIN_KEY_HEADER, required = false) String key,
            @PathVariable String accountId) {
        authorize(key);
        return ResponseEntity.ok(BanResponse.from(banService.find(accountId)));
    }

    @PostMapping
    public ResponseEntity<BanResponse> ban(@RequestHeader(value = ADMIN_KEY_HEADER, required = false) String key,
            @Valid @RequestBody BanRequest banRequest, HttpServletRequest httpRequest) {
        authorize(key);
        if (!banService.ban(banRequest.accountId(), clientAddressResolver.resolve(httpRequest),
                "MANUAL: " + banRequest.reason())) {
            throw new StoreUnavailableException("Ban of " + banRequest.accountId() + " could not be stored");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(BanResponse.from(banService.find(banRequest.accountId())));
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<Void> unban(@RequestHeader(value = ADMIN_KEY_HEADER, required = false) String key,
            @PathVariable String accountId) {
        authorize(key);
        banService.unban(accountId);
        return ResponseEntity.noContent().build();
    }

    private void authorize(String presentedKey) {
        if (adminApiKey == null || adminApiKey.isBlank() || presentedKey == null
                || !MessageDigest.isEqual(adminApiKey.getBytes(StandardCharsets.UTF_8),
                        presentedKey.getBytes(StandardCharsets.UTF_8))) {
            throw new AdminAccessDeniedException("Admin key missing or invalid");
        }
    }
}
