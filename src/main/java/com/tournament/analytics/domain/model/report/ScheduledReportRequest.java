package com.tournament.analytics.domain.model.report;

import com.tournament.analytics.infrastructure.persistence.entity.ReportDateRange;
import com.tournament.analytics.infrastructure.persistence.entity.ReportRecipient;
import com.tournament.analytics.infrastructure.persistence.entity.ReportSchedule;
import com.tournament.analytics.infrastructure.persistence.entity.ReportSections;
import com.tournament.analytics.infrastructure.persistence.entity.ScheduledReportEntity.ReportFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Create or update payload for a scheduled report. On update, null fields keep their
 * current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledReportRequest {

    @NotBlank
    @Size(max = 255)
    private String name;

    @Size(max = 1000)
    private String description;

    private Boolean enabled;

    @NotNull
    private ReportSchedule schedule;

    @NotEmpty
    private List<@Valid Recipient> recipients;

    private ReportFormat format;

    private ReportSections sections;

    private ReportDateRange dateRange;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Recipient {

        @NotBlank
        @Email
        private String email;

        private ReportRecipient.RecipientType type;

        public ReportRecipient toEmbeddable() {
            return ReportRecipient.builder()
                    .email(email)
                    .type(type != null ? type : ReportRecipient.RecipientType.TO)
                    .build();
        }
    }
}
