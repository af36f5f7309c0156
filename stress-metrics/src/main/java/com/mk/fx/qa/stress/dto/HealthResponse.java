package com.mk.fx.qa.stress.dto;

import com.mk.fx.qa.stress.model.RunRole;

/** Health of this metrics process: its role and whether the run has been finalized. */
public record HealthResponse(String status, RunRole role, boolean finalized) {}
