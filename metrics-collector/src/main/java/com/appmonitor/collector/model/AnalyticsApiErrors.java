package com.appmonitor.collector.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Error body: {@code {"errors":[{"status":"403","code":"FORBIDDEN_ERROR","title":"...","detail":"..."}]}}
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyticsApiErrors {

    private List<ApiError> errors = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiError {
        private String status;
        private String code;
        private String title;
        private String detail;
    }

    public String firstDetail() {
        if (errors == null || errors.isEmpty()) {
            return null;
        }
        ApiError first = errors.get(0);
        return first.getDetail() != null ? first.getDetail() : first.getTitle();
    }
}
