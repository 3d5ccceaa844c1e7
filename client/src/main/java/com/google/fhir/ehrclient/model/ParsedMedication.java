/*
 * Copyright 2021-2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.fhir.ehrclient.model;

import java.math.BigDecimal;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A prescription from a FHIR MedicationRequest. */
@Getter
@EqualsAndHashCode
public final class ParsedMedication {

  public static final String UNKNOWN_DISPLAY = "Unknown Medication";

  private final String id;
  @Nullable private final String patientId;
  @Nullable private final String rxnormCode;
  private final String displayName;
  @Nullable private final String dosageInstructions;
  @Nullable private final BigDecimal doseValue;
  @Nullable private final String doseUnit;
  @Nullable private final String frequencyCode;
  @Nullable private final String status;

  private ParsedMedication(Builder builder) {
    this.id = builder.id;
    this.patientId = builder.patientId;
    this.rxnormCode = builder.rxnormCode;
    this.displayName = builder.displayName;
    this.dosageInstructions = builder.dosageInstructions;
    this.doseValue = builder.doseValue;
    this.doseUnit = builder.doseUnit;
    this.frequencyCode = builder.frequencyCode;
    this.status = builder.status;
  }

  @Override
  public String toString() {
    return "ParsedMedication{id=" + id + "}";
  }

  public static class Builder {
    private String id = "";
    private String patientId;
    private String rxnormCode;
    private String displayName = UNKNOWN_DISPLAY;
    private String dosageInstructions;
    private BigDecimal doseValue;
    private String doseUnit;
    private String frequencyCode;
    private String status;

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setPatientId(@Nullable String patientId) {
      this.patientId = patientId;
      return this;
    }

    public Builder setRxnormCode(@Nullable String rxnormCode) {
      this.rxnormCode = rxnormCode;
      return this;
    }

    public Builder setDisplayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder setDosageInstructions(@Nullable String dosageInstructions) {
      this.dosageInstructions = dosageInstructions;
      return this;
    }

    public Builder setDoseValue(@Nullable BigDecimal doseValue) {
      this.doseValue = doseValue;
      return this;
    }

    public Builder setDoseUnit(@Nullable String doseUnit) {
      this.doseUnit = doseUnit;
      return this;
    }

    public Builder setFrequencyCode(@Nullable String frequencyCode) {
      this.frequencyCode = frequencyCode;
      return this;
    }

    public Builder setStatus(@Nullable String status) {
      this.status = status;
      return this;
    }

    public ParsedMedication build() {
      return new ParsedMedication(this);
    }
  }
}
