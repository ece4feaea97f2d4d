package com.appmonitor.collector.model;

public enum AlertDirection {
    BELOW_MINIMUM("below minimum"),
    ABOVE_MAXIMUM("above maximum");

    private final String label;

    AlertDirection(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
