package com.underwriting.engine.override;

public class CaseNotFoundException extends NotFoundException {
    public CaseNotFoundException(String caseId) {
        super("Case " + caseId + " not found", caseId);
    }
}
