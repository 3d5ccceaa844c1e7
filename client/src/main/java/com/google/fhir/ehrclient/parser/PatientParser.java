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
package com.google.fhir.ehrclient.parser;

import ca.uhn.fhir.model.api.TemporalPrecisionEnum;
import com.google.common.base.Strings;
import com.google.fhir.ehrclient.model.ParsedPatient;
import java.time.LocalDate;
import javax.annotation.Nullable;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.DateType;
import org.hl7.fhir.r4.model.HumanName;
import org.hl7.fhir.r4.model.Identifier;
import org.hl7.fhir.r4.model.Patient;

/**
 * Extracts a {@link ParsedPatient} from a FHIR Patient.
 *
 * <p>The MRN is the first identifier labelled as a medical record number, either through the type
 * text {@code MRN} or a type coding with the v2-0203 code {@code MR}. Without such a label the
 * first identifier that has a value is used.
 */
public class PatientParser {

  static final String MRN_TYPE_TEXT = "MRN";
  static final String MRN_TYPE_CODE = "MR";

  public ParsedPatient parse(Patient patient) {
    ParsedPatient.Builder builder =
        new ParsedPatient.Builder().setId(Strings.nullToEmpty(patient.getIdElement().getIdPart()));

    Identifier mrn = findMrn(patient);
    if (mrn != null) {
      builder.setMrn(mrn.getValue()).setMrnSystem(mrn.getSystem());
    }

    if (patient.hasName()) {
      HumanName name = patient.getNameFirstRep();
      if (name.hasGiven()) {
        builder.setGivenName(Strings.nullToEmpty(name.getGiven().get(0).getValue()));
      }
      if (name.hasFamily()) {
        builder.setFamilyName(name.getFamily());
      }
    }

    builder.setBirthDate(toLocalDate(patient.getBirthDateElement()));
    if (patient.hasGender()) {
      builder.setGender(patient.getGenderElement().getValueAsString());
    }
    return builder.build();
  }

  @Nullable
  private static Identifier findMrn(Patient patient) {
    Identifier firstWithValue = null;
    for (Identifier identifier : patient.getIdentifier()) {
      if (!identifier.hasValue()) {
        continue;
      }
      if (isLabelledMrn(identifier)) {
        return identifier;
      }
      if (firstWithValue == null) {
        firstWithValue = identifier;
      }
    }
    return firstWithValue;
  }

  private static boolean isLabelledMrn(Identifier identifier) {
    if (!identifier.hasType()) {
      return false;
    }
    CodeableConcept type = identifier.getType();
    if (MRN_TYPE_TEXT.equalsIgnoreCase(type.getText())) {
      return true;
    }
    for (Coding coding : type.getCoding()) {
      if (MRN_TYPE_CODE.equals(coding.getCode())) {
        return true;
      }
    }
    return false;
  }

  // Partial dates such as "1965" or "1965-03" have no LocalDate equivalent and are dropped.
  @Nullable
  private static LocalDate toLocalDate(DateType date) {
    if (date == null || !date.hasValue() || date.getPrecision() != TemporalPrecisionEnum.DAY) {
      return null;
    }
    return LocalDate.of(date.getYear(), date.getMonth() + 1, date.getDay());
  }
}
