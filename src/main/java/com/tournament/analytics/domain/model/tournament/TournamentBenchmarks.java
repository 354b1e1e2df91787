package com.tournament.analytics.domain.model.tournament;

import com.tournament.analytics.domain.model.BenchmarkStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentBenchmarks {

    private String tenantId;
    private String industry;
    private Benchmark completionRate;
    private Benchmark avgPlayers;
    private Benchmark avgDuration;
    private Benchmark playerRetention;
    private List<String> recommendations;
    private List<String> strengths;
    private List<String> improvementAreas;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Benchmark {
        private double target;
        private double current;
        private BenchmarkStatus status;
        private int percentile;
    }
}
