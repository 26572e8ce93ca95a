package com.mk.fx.qa.chatflow.rest;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE
}
