package com.ai.trainingstudio.dto;

import lombok.Value;

import java.util.Map;

@Value
public class ConfigurationOverview {

    /** Keyed by upload type key: courses, holidays, guidelines. */
    Map<String, OperationView> uploads;

    ReadinessStatus readiness;
}
