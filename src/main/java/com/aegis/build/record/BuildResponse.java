package com.aegis.build.record;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BuildResponse {

    Long buildId;
    String branch;
    String revision;
    String version;
    BuildStatus status;
    String buildOutput;
    Integer buildExitStatus;
    BigDecimal buildExecSec;
    BigDecimal buildSize;
    String previousVersion;
    Instant deployedAt;
    String deployOutput;
    Integer deployExitStatus;
    Instant revertedAt;
    String revertOutput;
    Integer revertExitStatus;
    Instant createdAt;
    Instant updatedAt;
    Instant deletedAt;
}
