package com.labpulse.driver;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;

/**
 * Shared, thread-safe collaborators handed to every driver instance.
 */
public record DriverContext(HttpClient httpClient, ObjectMapper objectMapper) {
}
