package com.example.rebus.interfaces.api;

/**
 * Request body of {@code POST /api/extract}.
 *
 * @param text raw model response
 */
public record ExtractionRequest(String text) {
}
