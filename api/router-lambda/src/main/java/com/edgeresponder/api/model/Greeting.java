package com.edgeresponder.api.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// GET /
@JsonPropertyOrder({"hello", "docs"})
public record Greeting(String hello, String docs) {}
