package com.skindx.application.assistant;

public enum AssistantRole {
    PATIENT, DOCTOR
}
