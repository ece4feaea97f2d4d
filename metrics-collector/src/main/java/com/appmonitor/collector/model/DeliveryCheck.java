package com.appmonitor.collector.model;

public record DeliveryCheck(boolean success, String message) {}
