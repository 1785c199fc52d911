package com.bbms.authbroker.modules.detection;

public enum DetectionType {
    COMPLETED,
    FAILED,
    EXPIRED
}
