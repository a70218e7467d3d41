package com.cohortaccel.service.pipeline;

import com.cohortaccel.model.enums.PipelineStage;

import java.time.Instant;

public record StageTransition(
    PipelineStage from,
    PipelineStage to,
    String reason,
    Instant at
) {}
