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

import com.google.common.base.Strings;
import com.google.fhir.ehrclient.FhirUtil;
import com.google.fhir.ehrclient.model.ParsedCondition;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Condition;

/** Extracts a {@link ParsedCondition} from a FHIR Condition. */
public class ConditionParser {

  public ParsedCondition parse(Condition condition) {
    ParsedCondition.Builder builder =
        new ParsedCondition.Builder()
            .setId(Strings.nullToEmpty(condition.getIdElement().getIdPart()));
    if (condition.hasSubject()) {
      builder.setPatientId(FhirUtil.referencedIdOrNull(condition.getSubject().getReference()));
    }

    CodeableConcept code = condition.hasCode() ? condition.getCode() : null;
    Coding icd10 = CodingSystems.ICD10.findCoding(code);
    Coding snomed = CodingSystems.SNOMED.findCoding(code);
    if (icd10 != null) {
      builder.setIcd10Code(icd10.getCode());
    }
    if (snomed != null) {
      builder.setSnomedCode(snomed.getCode());
    }
    Coding first = code != null && code.hasCoding() ? code.getCodingFirstRep() : null;
    if (icd10 == null && snomed == null && first != null && first.hasCode()) {
      builder.setFallbackCode(first.getCode()).setFallbackSystem(first.getSystem());
    }
    builder.setDisplayText(displayText(code, icd10, snomed, first));

    if (condition.hasClinicalStatus() && condition.getClinicalStatus().hasCoding()) {
      Coding status = condition.getClinicalStatus().getCodingFirstRep();
      if (status.hasCode()) {
        builder.setClinicalStatus(status.getCode());
      }
    }
    return builder.build();
  }

  private static String displayText(
      CodeableConcept code, Coding icd10, Coding snomed, Coding first) {
    if (code != null && code.hasText()) {
      return code.getText();
    }
    if (icd10 != null && icd10.hasDisplay()) {
      return icd10.getDisplay();
    }
    if (snomed != null && snomed.hasDisplay()) {
      return snomed.getDisplay();
    }
    if (first != null && first.hasDisplay()) {
      return first.getDisplay();
    }
    return ParsedCondition.UNKNOWN_DISPLAY;
  }
}
