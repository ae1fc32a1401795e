package org.calista.arasaka.blueprint.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class TurnEvent {
    public String type;        // "USER", "SUMMARY", "REVISION", "APPLY"
    public long tsEpochMs;
    public String sessionId;
    public String text;

    public static TurnEvent of(String type, String sessionId, String text, long tsEpochMs) {
        TurnEvent e = new TurnEvent();
        e.type = type;
        e.sessionId = sessionId;
        e.text = text;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
