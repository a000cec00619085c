package com.heist.backend.dto;

import com.heist.backend.model.Signal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class IngestResponse {
    private boolean signalEmitted;
    private Signal signal;
}
