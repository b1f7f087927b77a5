package org.caureq.homesentry.service.alerts;

public record GraceDecision(boolean proceed, String reason) {}
