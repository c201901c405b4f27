package com.aegis.build.record;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BuildStartRequest {

    @NotBlank
    @Size(max = 100)
    String branch;

    @NotBlank
    @Size(max = 100)
    String revision;
}
