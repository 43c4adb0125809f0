package com.ai.trainingstudio.workflow;

/** How a rendered result is presented: readable text or the raw JSON. */
public enum ViewMode {
    PREVIEW,
    RAW
}
