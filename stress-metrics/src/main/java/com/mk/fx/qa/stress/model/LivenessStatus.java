package com.mk.fx.qa.stress.model;

public enum LivenessStatus {
  ACTIVE,
  STALE,
  FINISHED
}
