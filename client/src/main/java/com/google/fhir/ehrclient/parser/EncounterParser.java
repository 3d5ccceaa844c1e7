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
import com.google.common.collect.Lists;
import com.google.fhir.ehrclient.FhirUtil;
import com.google.fhir.ehrclient.model.ParsedEncounter;
import java.util.List;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.Period;
import org.hl7.fhir.r4.model.Reference;

/** Extracts a {@link ParsedEncounter} from a FHIR Encounter. */
public class EncounterParser {

  public ParsedEncounter parse(Encounter encounter) {
    ParsedEncounter.Builder builder =
        new ParsedEncounter.Builder()
            .setId(Strings.nullToEmpty(encounter.getIdElement().getIdPart()));
    if (encounter.hasSubject()) {
      builder.setPatientId(FhirUtil.referencedIdOrNull(encounter.getSubject().getReference()));
    }
    if (encounter.hasStatus()) {
      builder.setStatus(encounter.getStatusElement().getValueAsString());
    }

    if (encounter.hasClass_()) {
      Coding encounterClass = encounter.getClass_();
      if (encounterClass.hasDisplay()) {
        builder.setEncounterType(encounterClass.getDisplay());
      } else if (encounterClass.hasCode()) {
        builder.setEncounterType(encounterClass.getCode());
      }
    }

    List<String> typeDescriptions = Lists.newArrayList();
    for (CodeableConcept type : encounter.getType()) {
      for (Coding coding : type.getCoding()) {
        if (coding.hasDisplay()) {
          typeDescriptions.add(coding.getDisplay());
        }
      }
    }
    builder.setTypeDescriptions(typeDescriptions);

    if (encounter.hasLocation() && encounter.getLocationFirstRep().hasLocation()) {
      Reference location = encounter.getLocationFirstRep().getLocation();
      if (location.hasDisplay()) {
        builder.setLocation(location.getDisplay());
      } else if (location.hasReference()) {
        builder.setLocation(location.getReference());
      }
    }

    if (encounter.hasPeriod()) {
      Period period = encounter.getPeriod();
      if (period.hasStart()) {
        builder.setStart(period.getStart().toInstant());
      }
      if (period.hasEnd()) {
        builder.setEnd(period.getEnd().toInstant());
      }
    }
    return builder.build();
  }
}
