package com.tournament.analytics.domain.model.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportAttachment {

    private String filename;
    private String contentType;
    private byte[] content;

    public long size() {
        return content != null ? content.length : 0;
    }
}
