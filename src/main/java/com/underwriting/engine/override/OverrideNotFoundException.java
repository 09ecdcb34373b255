package com.underwriting.engine.override;

public class OverrideNotFoundException extends NotFoundException {
    public OverrideNotFoundException(String overrideId) {
        super("Override " + overrideId + " not found", overrideId);
    }
}
