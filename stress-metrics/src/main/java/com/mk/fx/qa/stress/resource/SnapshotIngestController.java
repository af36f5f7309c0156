package com.mk.fx.qa.stress.resource;

import com.mk.fx.qa.stress.aggregate.GlobalAggregator;
import com.mk.fx.qa.stress.dto.IngestResponse;
import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import com.mk.fx.qa.stress.model.IngestResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Snapshots", description = "Coordinator endpoint workers report to")
@RestController
@RequiredArgsConstructor
public class SnapshotIngestController {

  private final GlobalAggregator aggregator;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Ingest a worker snapshot",
      description =
          "202 when applied, 200 when ignored as a duplicate or out-of-order delivery, 400 when"
              + " rejected as malformed or built with different latency buckets.")
  @PostMapping("/api/snapshots")
  public ResponseEntity<IngestResponse> ingest(@RequestBody WorkerSnapshot snapshot) {
    IngestResult result = aggregator.accept(snapshot);
    log.debug("Snapshot {}#{} -> {}", snapshot.workerId(), snapshot.sequence(), result);
    return responseFactory.ingest(
        new IngestResponse(snapshot.workerId(), snapshot.sequence(), result));
  }
}
