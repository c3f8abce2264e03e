package com.bizplanner.orchestrator.exception;

import lombok.Getter;

@Getter
public class SkillExecutionException extends RuntimeException {

    private final String skillId;

    public SkillExecutionException(String message, String skillId) {
        super(message);
        this.skillId = skillId;
    }

    public SkillExecutionException(String message, String skillId, Throwable cause) {
        super(message, cause);
        this.skillId = skillId;
    }
}
