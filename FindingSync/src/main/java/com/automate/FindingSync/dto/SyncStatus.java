package com.automate.FindingSync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncStatus {

    public enum State {
        IDLE, RUNNING, COMPLETED, FAILED;

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private State status;
    private Integer progress;
    private String step;
    private Instant startedAt;
    private Instant completedAt;
    private String error;
    private SyncResult result;

    public static SyncStatus idle() {
        return SyncStatus.builder().status(State.IDLE).build();
    }
}
