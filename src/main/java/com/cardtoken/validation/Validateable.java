package com.cardtoken.validation;

/**
 * Capability of objects that can check their own field constraints.
 */
public interface Validateable {

    /**
     * Run every validation check, adding findings to the given collector.
     * Implementations must not stop at the first failure.
     *
     * @param errors collector that receives the findings
     */
    void validate(ValidationErrors errors);

    /**
     * Validate into a fresh collector.
     */
    default ValidationErrors validate() {
        ValidationErrors errors = new ValidationErrors();
        validate(errors);
        return errors;
    }

    default boolean isValid() {
        return validate().isEmpty();
    }
}
