package com.bank.billshock.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class Slf4jPipelineReporter implements PipelineReporter {

    static final String LOGGER_NAME = "billshock.pipeline";

    private final Logger log;

    public Slf4jPipelineReporter() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    Slf4jPipelineReporter(Logger log) {
        this.log = log;
    }

    @Override
    public void info(String message) {
        log.info(message);
    }

    @Override
    public void warn(String message) {
        log.warn(message);
    }

    @Override
    public void error(String message) {
        log.error(message);
    }
}
