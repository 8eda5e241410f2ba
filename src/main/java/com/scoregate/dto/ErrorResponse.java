package com.scoregate.dto;

public record ErrorResponse(String code, String message) {
}
