package com.anomalywatch.exception;

public class UnknownInvestigatorTypeException extends InvestigationException {

    private final String typeCode;

    public UnknownInvestigatorTypeException(String typeCode) {
        super("Unknown investigator type: " + typeCode);
        this.typeCode = typeCode;
    }

    public String getTypeCode() {
        return typeCode;
    }
}
