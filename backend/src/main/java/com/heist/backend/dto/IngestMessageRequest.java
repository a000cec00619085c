package com.heist.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestMessageRequest {

    @NotBlank
    @Size(max = 20000)
    private String text;

    @NotBlank
    private String platform;

    @NotBlank
    private String channel;

    private String messageId;
}
