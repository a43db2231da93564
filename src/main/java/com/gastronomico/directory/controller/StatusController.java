package com.gastronomico.directory.controller;

import com.gastronomico.directory.config.DirectoryProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class StatusController {

    private final DirectoryProperties properties;

    public StatusController(DirectoryProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/api/health")
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("message", "Directory API running - version " + properties.getVersion());
        return body;
    }

    /** Landing document listing the main endpoints. */
    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/api/health");
        endpoints.put("cities", "/api/cities");
        endpoints.put("sponsors", "/api/sponsors");
        endpoints.put("restaurants", "/api/restaurants");
        endpoints.put("events", "/api/events");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("message", "Gastronomic directory API");
        body.put("endpoints", endpoints);
        return body;
    }
}
