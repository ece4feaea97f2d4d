package com.appmonitor.collector.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.helpers.MessageFormatter;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Output and error text captured for one execution record. Every line is also written to the
 * application log.
 */
@Slf4j
public class ExecutionLog {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;
    private final StringBuilder output = new StringBuilder();
    private final StringBuilder errors = new StringBuilder();

    public ExecutionLog(Clock clock) {
        this.clock = clock;
    }

    public void info(String pattern, Object... args) {
        String line = MessageFormatter.arrayFormat(pattern, args).getMessage();
        log.info(line);
        append(output, line);
    }

    public void error(String pattern, Object... args) {
        String line = MessageFormatter.arrayFormat(pattern, args).getMessage();
        log.error(line);
        append(errors, line);
    }

    public synchronized String output() {
        return output.toString();
    }

    public synchronized String errors() {
        return errors.toString();
    }

    private synchronized void append(StringBuilder target, String line) {
        target.append('[').append(LocalTime.now(clock).format(TIME)).append("] ").append(line).append('\n');
    }
}
