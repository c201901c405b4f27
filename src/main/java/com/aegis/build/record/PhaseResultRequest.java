package com.aegis.build.record;

import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PhaseResultRequest {

    String output;

    @NotNull
    Integer exitStatus;

    Instant occurredAt;
}
