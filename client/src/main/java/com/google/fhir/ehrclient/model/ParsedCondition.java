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

import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A diagnosis from a FHIR Condition. ICD-10 and SNOMED codes are independent of each other; the
 * fallback code and system are only set when the condition carries neither of them.
 */
@Getter
@EqualsAndHashCode
public final class ParsedCondition {

  public static final String UNKNOWN_DISPLAY = "Unknown Condition";
  public static final String UNKNOWN_STATUS = "unknown";

  private final String id;
  @Nullable private final String patientId;
  @Nullable private final String icd10Code;
  @Nullable private final String snomedCode;
  @Nullable private final String fallbackCode;
  @Nullable private final String fallbackSystem;
  private final String displayText;
  private final String clinicalStatus;

  private ParsedCondition(Builder builder) {
    this.id = builder.id;
    this.patientId = builder.patientId;
    this.icd10Code = builder.icd10Code;
    this.snomedCode = builder.snomedCode;
    this.fallbackCode = builder.fallbackCode;
    this.fallbackSystem = builder.fallbackSystem;
    this.displayText = builder.displayText;
    this.clinicalStatus = builder.clinicalStatus;
  }

  /** The ICD-10 code if present, then the SNOMED code, then the fallback code. */
  @Nullable
  public String getPrimaryCode() {
    if (icd10Code != null) {
      return icd10Code;
    }
    if (snomedCode != null) {
      return snomedCode;
    }
    return fallbackCode;
  }

  public boolean isActive() {
    return "active".equals(clinicalStatus);
  }

  @Override
  public String toString() {
    return "ParsedCondition{id=" + id + "}";
  }

  public static class Builder {
    private String id = "";
    private String patientId;
    private String icd10Code;
    private String snomedCode;
    private String fallbackCode;
    private String fallbackSystem;
    private String displayText = UNKNOWN_DISPLAY;
    private String clinicalStatus = UNKNOWN_STATUS;

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setPatientId(@Nullable String patientId) {
      this.patientId = patientId;
      return this;
    }

    public Builder setIcd10Code(@Nullable String icd10Code) {
      this.icd10Code = icd10Code;
      return this;
    }

    public Builder setSnomedCode(@Nullable String snomedCode) {
      this.snomedCode = snomedCode;
      return this;
    }

    public Builder setFallbackCode(@Nullable String fallbackCode) {
      this.fallbackCode = fallbackCode;
      return this;
    }

    public Builder setFallbackSystem(@Nullable String fallbackSystem) {
      this.fallbackSystem = fallbackSystem;
      return this;
    }

    public Builder setDisplayText(String displayText) {
      this.displayText = displayText;
      return this;
    }

    public Builder setClinicalStatus(String clinicalStatus) {
      this.clinicalStatus = clinicalStatus;
      return this;
    }

    public ParsedCondition build() {
      return new ParsedCondition(this);
    }
  }
}
