package com.mk.fx.qa.stress.rest;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Object body;

  public static Request post(String path, Object body) {
    return new Request(HttpMethod.POST, path, Map.of(), body);
  }
}
