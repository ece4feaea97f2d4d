package com.appmonitor.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * One JSON:API resource from the async-report analytics API. The same shape covers apps,
 * report requests, reports, report instances and segments; each uses a subset of the attributes.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyticsApiResource {

    private String id;
    private String type;
    private Attributes attributes = new Attributes();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attributes {
        // apps
        private String name;
        private String bundleId;

        // analyticsReportRequests
        private String accessType;
        private Boolean stoppedDueToInactivity;

        // analyticsReports
        private String category;

        // analyticsReportInstances
        private String granularity;
        private String processingDate;

        // analyticsReportSegments
        private String url;
        private String checksum;
        private Long sizeInBytes;
    }

    public boolean isActiveOngoingRequest() {
        return attributes != null
                && "ONGOING".equals(attributes.getAccessType())
                && !Boolean.TRUE.equals(attributes.getStoppedDueToInactivity());
    }
}
