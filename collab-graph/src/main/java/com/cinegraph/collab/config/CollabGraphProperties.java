package com.cinegraph.collab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "collab-graph")
@Data
public class CollabGraphProperties {

    private Edges edges = new Edges();
    private Paths paths = new Paths();
    private Trend trend = new Trend();
    private Population population = new Population();
    private Store store = new Store();
    private Output output = new Output();

    @Data
    public static class Edges {
        private int performerPerformerCap = 10;
        private int performerDirectorCap = 20;

        /** Crew roles that generate edges. No default: must be supplied. */
        private List<String> keyCrewRoles = new ArrayList<>();
    }

    @Data
    public static class Paths {
        private int defaultMaxDepth = 6;
        private Duration cacheTtl = Duration.ofDays(7);
        private boolean opportunisticCaching = true;
        private String purgeCron = "0 0 * * * ?";
    }

    @Data
    public static class Trend {
        private int windowYears = 2;
        private double halfLifeYears = 1.0;
        private String cron = "0 0 3 * * ?";
    }

    @Data
    public static class Population {
        private int parallelism = 4;
        private boolean rebuildOnStartup = false;
    }

    @Data
    public static class Store {
        private int maxAttempts = 3;
        private Duration retryWait = Duration.ofMillis(200);
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }
    }
}
