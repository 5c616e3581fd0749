package com.mk.fx.qa.dbstress.engine.client;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE
}
