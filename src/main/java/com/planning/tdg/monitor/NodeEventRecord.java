package com.planning.tdg.monitor;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/** One entry of the monitor's event log. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeEventRecord(
        @JsonProperty("node_id") String nodeId,
        @JsonProperty("event") Kind kind,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("duration") Double duration,
        @JsonProperty("error") String error) {

    public enum Kind {
        STARTED,
        COMPLETED,
        FAILED,
        STATUS_CHANGED;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase();
        }
    }

    static NodeEventRecord started(String nodeId, Instant at) {
        return new NodeEventRecord(nodeId, Kind.STARTED, at, null, null);
    }

    static NodeEventRecord completed(String nodeId, Instant at, Double duration) {
        return new NodeEventRecord(nodeId, Kind.COMPLETED, at, duration, null);
    }

    static NodeEventRecord failed(String nodeId, Instant at, String error) {
        return new NodeEventRecord(nodeId, Kind.FAILED, at, null, error);
    }
}
