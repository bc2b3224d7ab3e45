package com.ecgheartbeat.backend.service.classification;

import com.ecgheartbeat.backend.entity.EcgStatus;

public record HeartRateAssessment(EcgStatus status, String condition) {}
