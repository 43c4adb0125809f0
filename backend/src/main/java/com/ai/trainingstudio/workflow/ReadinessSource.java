package com.ai.trainingstudio.workflow;

import com.ai.trainingstudio.dto.ReadinessStatus;

@FunctionalInterface
public interface ReadinessSource {

    ReadinessStatus readiness();
}
