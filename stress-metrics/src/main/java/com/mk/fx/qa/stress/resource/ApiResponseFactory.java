package com.mk.fx.qa.stress.resource;

import com.mk.fx.qa.stress.cfg.ErrorResponse;
import com.mk.fx.qa.stress.dto.IngestResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class ApiResponseFactory {

  public ResponseEntity<ErrorResponse> error(HttpStatus status, String title, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(title, message));
  }

  public <T> ResponseEntity<T> ok(T body) {
    return ResponseEntity.ok(body);
  }

  /** 202 for an applied snapshot, 200 for an ignored one, 400 for a rejected one. */
  public ResponseEntity<IngestResponse> ingest(IngestResponse body) {
    HttpStatus status =
        switch (body.result()) {
          case ACCEPTED -> HttpStatus.ACCEPTED;
          case IGNORED -> HttpStatus.OK;
          case REJECTED -> HttpStatus.BAD_REQUEST;
        };
    return ResponseEntity.status(status).body(body);
  }
}
