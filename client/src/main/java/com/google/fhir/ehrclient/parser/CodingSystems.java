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

import java.util.Locale;
import javax.annotation.Nullable;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Coding;

/**
 * Coding systems recognised when extracting codes. Servers spell system URIs inconsistently
 * (OIDs, http vs https, version suffixes), so systems are matched by a case-insensitive marker
 * rather than by exact URI.
 */
public enum CodingSystems {
  ICD10("http://hl7.org/fhir/sid/icd-10", "icd-10"),
  SNOMED("http://snomed.info/sct", "snomed"),
  RXNORM("http://www.nlm.nih.gov/research/umls/rxnorm", "rxnorm");

  private final String uri;
  private final String marker;

  CodingSystems(String uri, String marker) {
    this.uri = uri;
    this.marker = marker;
  }

  public String getUri() {
    return uri;
  }

  public boolean matches(@Nullable String system) {
    return system != null && system.toLowerCase(Locale.ROOT).contains(marker);
  }

  /** Returns the first coding of {@code concept} in this system that has a code, or null. */
  @Nullable
  public Coding findCoding(@Nullable CodeableConcept concept) {
    if (concept == null) {
      return null;
    }
    for (Coding coding : concept.getCoding()) {
      if (coding.hasCode() && matches(coding.getSystem())) {
        return coding;
      }
    }
    return null;
  }
}
