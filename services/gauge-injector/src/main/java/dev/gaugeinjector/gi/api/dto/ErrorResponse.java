package dev.gaugeinjector.gi.api.dto;

public record ErrorResponse(String code, String message) {
}
