package com.mk.fx.qa.stress.model;

/** What the global aggregator did with an arriving worker snapshot. */
public enum IngestResult {
  /** Newer than anything seen from the worker; now its latest truth. */
  ACCEPTED,
  /** Sequence not above the stored one (duplicate or reordered delivery), or run already final. */
  IGNORED,
  /** Malformed, or built with different bucket boundaries than the run. */
  REJECTED
}
