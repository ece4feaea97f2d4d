package com.appmonitor.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A page of a JSON:API collection. {@code links.next} is absent on the last page.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyticsApiPage {

    private List<AnalyticsApiResource> data = new ArrayList<>();
    private Links links;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Links {
        private String self;
        private String next;
    }

    public String nextLink() {
        return links != null ? links.getNext() : null;
    }
}
