package com.tournament.analytics.domain.model.report;

import com.tournament.analytics.infrastructure.persistence.entity.ReportDeliveryEntity.DeliveryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportRunResult {

    private UUID reportId;
    private UUID deliveryId;
    private DeliveryStatus status;

    /**
     * True when the report was disabled or deleted and nothing was generated.
     */
    private boolean skipped;

    private List<String> recipients;
    private long fileSize;
    private List<String> skippedSections;
    private Instant nextRunAt;
}
