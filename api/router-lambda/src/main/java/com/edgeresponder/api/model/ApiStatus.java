package com.edgeresponder.api.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// GET /api
@JsonPropertyOrder({"ok", "msg"})
public record ApiStatus(boolean ok, String msg) {}
