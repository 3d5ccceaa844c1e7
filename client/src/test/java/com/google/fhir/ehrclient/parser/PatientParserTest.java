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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

import ca.uhn.fhir.context.FhirContext;
import com.google.fhir.ehrclient.FhirUtil;
import com.google.fhir.ehrclient.TestUtil;
import com.google.fhir.ehrclient.model.ParsedPatient;
import java.io.IOException;
import java.time.LocalDate;
import org.hl7.fhir.r4.model.DateType;
import org.hl7.fhir.r4.model.Patient;
import org.junit.Test;

public class PatientParserTest {

  private final FhirContext fhirContext = FhirUtil.createFhirContext();

  private final PatientParser parser = new PatientParser();

  @Test
  public void parse_fixturePatient_extractsDemographics() throws IOException {
    Patient patient = TestUtil.loadResource(fhirContext, "patient_smith.json", Patient.class);

    ParsedPatient parsed = parser.parse(patient);

    assertThat(parsed.getId(), equalTo("eXYZ123"));
    assertThat(parsed.getMrn(), equalTo("12345678"));
    assertThat(parsed.getMrnSystem(), equalTo("urn:oid:1.2.840.114350"));
    assertThat(parsed.getGivenName(), equalTo("John"));
    assertThat(parsed.getFamilyName(), equalTo("Smith"));
    assertThat(parsed.getFullName(), equalTo("John Smith"));
    assertThat(parsed.getBirthDate(), equalTo(LocalDate.of(1965, 3, 15)));
    assertThat(parsed.getGender(), equalTo("male"));
  }

  @Test
  public void parse_mrTypeCoding_isPreferredOverEarlierIdentifier() {
    Patient patient = new Patient();
    patient.setId("p1");
    patient.addIdentifier().setSystem("urn:other").setValue("X-1");
    patient
        .addIdentifier()
        .setSystem("urn:mrn")
        .setValue("M-2")
        .getType()
        .addCoding()
        .setSystem("http://terminology.hl7.org/CodeSystem/v2-0203")
        .setCode("MR");

    ParsedPatient parsed = parser.parse(patient);

    assertThat(parsed.getMrn(), equalTo("M-2"));
    assertThat(parsed.getMrnSystem(), equalTo("urn:mrn"));
  }

  @Test
  public void parse_noLabelledIdentifier_usesFirstWithValue() {
    Patient patient = new Patient();
    patient.setId("p1");
    patient.addIdentifier().setSystem("urn:empty");
    patient.addIdentifier().setSystem("urn:first").setValue("F-1");
    patient.addIdentifier().setSystem("urn:second").setValue("S-2");

    ParsedPatient parsed = parser.parse(patient);

    assertThat(parsed.getMrn(), equalTo("F-1"));
    assertThat(parsed.getMrnSystem(), equalTo("urn:first"));
  }

  @Test
  public void parse_missingOptionalFields_yieldsEmptyValues() {
    Patient patient = new Patient();
    patient.setId("p1");

    ParsedPatient parsed = parser.parse(patient);

    assertThat(parsed.getId(), equalTo("p1"));
    assertThat(parsed.getMrn(), nullValue());
    assertThat(parsed.getGivenName(), equalTo(""));
    assertThat(parsed.getFamilyName(), equalTo(""));
    assertThat(parsed.getFullName(), equalTo(""));
    assertThat(parsed.getBirthDate(), nullValue());
    assertThat(parsed.getGender(), nullValue());
  }

  @Test
  public void parse_familyNameOnly_fullNameHasNoPadding() {
    Patient patient = new Patient();
    patient.setId("p1");
    patient.addName().setFamily("Doe");

    assertThat(parser.parse(patient).getFullName(), equalTo("Doe"));
  }

  @Test
  public void parse_partialBirthDate_isDropped() {
    Patient patient = new Patient();
    patient.setId("p1");
    patient.setBirthDateElement(new DateType("1965"));

    assertThat(parser.parse(patient).getBirthDate(), nullValue());
  }

  @Test
  public void parse_genderOutsideR4Codes_keepsRawValue() throws IOException {
    Patient patient =
        TestUtil.loadResource(fhirContext, "patient_unknown_gender.json", Patient.class);

    ParsedPatient parsed = parser.parse(patient);

    assertThat(parsed.getId(), equalTo("eUNK001"));
    assertThat(parsed.getMrn(), equalTo("55554444"));
    assertThat(parsed.getFullName(), equalTo("Maria Garcia"));
    assertThat(parsed.getBirthDate(), equalTo(LocalDate.of(1972, 11, 2)));
    assertThat(parsed.getGender(), equalTo("M"));
  }
}
