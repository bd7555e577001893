package com.ledgerly.backend.classification.dto;

import java.time.Instant;
import java.util.List;

public record ModelTrainingReportDTO(
        int sampleCount,
        List<String> categories,
        int vocabularySize,
        Double holdoutAccuracy,
        Instant trainedAt
) {}
