package com.underwriting.engine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A disclosed medical condition or medication on a case.
 */
public class MedicalDisclosure {

    public static final String TYPE_CONDITION = "condition";
    public static final String TYPE_MEDICATION = "medication";

    @JsonProperty("disclosureType")
    private String disclosureType;

    @JsonProperty("conditionName")
    private String conditionName;

    @JsonProperty("drugName")
    private String drugName;

    public MedicalDisclosure() {
    }

    public MedicalDisclosure(String disclosureType, String conditionName, String drugName) {
        this.disclosureType = disclosureType;
        this.conditionName = conditionName;
        this.drugName = drugName;
    }

    public static MedicalDisclosure condition(String conditionName) {
        return new MedicalDisclosure(TYPE_CONDITION, conditionName, null);
    }

    public static MedicalDisclosure medication(String drugName) {
        return new MedicalDisclosure(TYPE_MEDICATION, null, drugName);
    }

    public boolean isCondition() {
        return TYPE_CONDITION.equals(disclosureType);
    }

    public boolean isMedication() {
        return TYPE_MEDICATION.equals(disclosureType);
    }

    public String getDisclosureType() {
        return disclosureType;
    }

    public void setDisclosureType(String disclosureType) {
        this.disclosureType = disclosureType;
    }

    public String getConditionName() {
        return conditionName;
    }

    public void setConditionName(String conditionName) {
        this.conditionName = conditionName;
    }

    public String getDrugName() {
        return drugName;
    }

    public void setDrugName(String drugName) {
        this.drugName = drugName;
    }
}
