package com.ai.trainingstudio.workflow;

import com.ai.trainingstudio.dto.PersonalizationDefaults;

@FunctionalInterface
public interface PersonalizationSource {

    PersonalizationDefaults currentDefaults();
}
