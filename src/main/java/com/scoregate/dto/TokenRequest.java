package com.scoregate.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

public record TokenRequest(
        @JsonAlias("steamId") String accountId,
        String ticket) {
}
