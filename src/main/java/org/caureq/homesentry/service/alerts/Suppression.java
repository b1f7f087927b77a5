package org.caureq.homesentry.service.alerts;

/** Verdict of a suppression policy, with the reason logged by the engine. */
public record Suppression(boolean suppressed, String reason) {
    public static Suppression suppress(String reason) { return new Suppression(true, reason); }
    public static Suppression allow(String reason) { return new Suppression(false, reason); }
}
