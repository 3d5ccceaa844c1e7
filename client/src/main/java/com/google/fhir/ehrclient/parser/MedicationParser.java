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
import com.google.fhir.ehrclient.model.ParsedMedication;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Dosage;
import org.hl7.fhir.r4.model.Dosage.DosageDoseAndRateComponent;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.Quantity;
import org.hl7.fhir.r4.model.Reference;

/** Extracts a {@link ParsedMedication} from a FHIR MedicationRequest. */
public class MedicationParser {

  public ParsedMedication parse(MedicationRequest request) {
    ParsedMedication.Builder builder =
        new ParsedMedication.Builder()
            .setId(Strings.nullToEmpty(request.getIdElement().getIdPart()));
    if (request.hasSubject()) {
      builder.setPatientId(FhirUtil.referencedIdOrNull(request.getSubject().getReference()));
    }
    if (request.hasStatus()) {
      builder.setStatus(request.getStatusElement().getValueAsString());
    }

    CodeableConcept concept = request.hasMedicationCodeableConcept()
        ? request.getMedicationCodeableConcept()
        : null;
    Coding rxnorm = CodingSystems.RXNORM.findCoding(concept);
    if (rxnorm != null) {
      builder.setRxnormCode(rxnorm.getCode());
    }
    if (concept != null && concept.hasText()) {
      builder.setDisplayName(concept.getText());
    } else if (concept != null && concept.hasCoding() && concept.getCodingFirstRep().hasDisplay()) {
      builder.setDisplayName(concept.getCodingFirstRep().getDisplay());
    } else if (request.hasMedicationReference()) {
      Reference reference = request.getMedicationReference();
      if (reference.hasDisplay()) {
        builder.setDisplayName(reference.getDisplay());
      }
    }

    if (request.hasDosageInstruction()) {
      Dosage dosage = request.getDosageInstructionFirstRep();
      if (dosage.hasText()) {
        builder.setDosageInstructions(dosage.getText());
      }
      if (dosage.hasDoseAndRate() && dosage.getDoseAndRateFirstRep().hasDoseQuantity()) {
        DosageDoseAndRateComponent doseAndRate = dosage.getDoseAndRateFirstRep();
        Quantity dose = doseAndRate.getDoseQuantity();
        if (dose.hasValue()) {
          builder.setDoseValue(dose.getValue());
        }
        if (dose.hasUnit()) {
          builder.setDoseUnit(dose.getUnit());
        } else if (dose.hasCode()) {
          builder.setDoseUnit(dose.getCode());
        }
      }
      if (dosage.hasTiming() && dosage.getTiming().hasCode()) {
        CodeableConcept timing = dosage.getTiming().getCode();
        if (timing.hasCoding() && timing.getCodingFirstRep().hasCode()) {
          builder.setFrequencyCode(timing.getCodingFirstRep().getCode());
        } else if (timing.hasText()) {
          builder.setFrequencyCode(timing.getText());
        }
      }
    }
    return builder.build();
  }
}
