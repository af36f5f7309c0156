package com.mk.fx.qa.stress.dto;

/** Outcome of a stop request. */
public record StopResponse(
    String runId, String status, long operations, int staleWorkers, String exportPath) {}
