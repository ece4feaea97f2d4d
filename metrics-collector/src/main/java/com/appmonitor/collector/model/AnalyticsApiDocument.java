package com.appmonitor.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Single-resource JSON:API document, as returned when a resource is created.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyticsApiDocument {

    private AnalyticsApiResource data;
}
