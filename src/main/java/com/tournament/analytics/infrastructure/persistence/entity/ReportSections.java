package com.tournament.analytics.infrastructure.persistence.entity;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportSections {

    @Builder.Default
    private boolean summary = true;

    @Builder.Default
    private boolean revenue = true;

    private boolean users;

    private boolean cohorts;

    @Builder.Default
    private boolean tournaments = true;

    private boolean predictions;
}
