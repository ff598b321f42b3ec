package tech.andrefsramos.offer_tracker.adapters.inbound.api;

public record PreviewRequest(String operator, String text, String strategy) {}
