package com.mk.fx.qa.stress.rest;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE
}
