package com.aegis.build.record;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BuildResultRequest {

    @Size(max = 100)
    String version;

    String output;

    @NotNull
    Integer exitStatus;

    // build_exec_sec and build_size are DECIMAL(10,0)
    @PositiveOrZero
    @Digits(integer = 10, fraction = 0)
    BigDecimal execSec;

    @PositiveOrZero
    @Digits(integer = 10, fraction = 0)
    BigDecimal size;

    @Size(max = 100)
    String previousVersion;
}
