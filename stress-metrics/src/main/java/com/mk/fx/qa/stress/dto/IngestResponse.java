package com.mk.fx.qa.stress.dto;

import com.mk.fx.qa.stress.model.IngestResult;

/** Reply to a worker that posted a snapshot. */
public record IngestResponse(String workerId, long sequence, IngestResult result) {}
