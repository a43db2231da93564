package com.gastronomico.directory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "directory")
public class DirectoryProperties {

    /** Reported by the health endpoint. */
    private String version = "1.0.2";

    private Cors cors = new Cors();

    private Events events = new Events();

    @Data
    public static class Cors {

        /** Origin patterns allowed to call /api/**; "*" is accepted. */
        private List<String> allowedOrigins = new ArrayList<>(List.of(
                "http://localhost:3000",
                "http://localhost:8081",
                "http://localhost:19006"));
    }

    @Data
    public static class Events {

        /** Lifetime of one SSE connection; zero keeps it open until the client leaves. */
        private Duration timeout = Duration.ZERO;
    }
}
