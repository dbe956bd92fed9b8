package com.bank.billshock.service;

/**
 * Where the training and detection pipelines report progress and problems. The pipelines do
 * not configure logging themselves; the host application decides where these messages go.
 */
public interface PipelineReporter {

    void info(String message);

    void warn(String message);

    void error(String message);
}
