package com.bizplanner.orchestrator.skill;

/**
 * Result from a skill execution.
 *
 * @since 2.0.0
 */
public interface SkillResult {

    boolean isSuccess();

    /**
     * The primary result data. Serialized to JSON when returned to the model.
     */
    Object getData();

    /**
     * Human-readable message, used for logging and as the error text on failure.
     */
    String getMessage();

    static SkillResult success(Object data, String message) {
        return new SkillResultImpl(true, data, message);
    }

    static SkillResult failure(String message) {
        return new SkillResultImpl(false, null, message);
    }
}

/**
 * Default implementation of SkillResult.
 */
record SkillResultImpl(boolean isSuccess, Object data, String message) implements SkillResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public Object getData() {
        return data;
    }

    @Override
    public String getMessage() {
        return message;
    }
}
