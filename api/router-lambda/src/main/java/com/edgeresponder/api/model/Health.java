package com.edgeresponder.api.model;

// GET /api/health
public record Health(String status) {}
