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
package com.google.fhir.ehrclient;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.fhir.ehrclient.model.ParsedCondition;
import com.google.fhir.ehrclient.model.ParsedEncounter;
import com.google.fhir.ehrclient.model.ParsedMedication;
import com.google.fhir.ehrclient.model.ParsedPatient;
import com.google.fhir.ehrclient.parser.BarcodeParser;
import com.google.fhir.ehrclient.parser.ConditionParser;
import com.google.fhir.ehrclient.parser.EncounterParser;
import com.google.fhir.ehrclient.parser.MedicationParser;
import com.google.fhir.ehrclient.parser.PatientParser;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.Attachment;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.DocumentReference;
import org.hl7.fhir.r4.model.DocumentReference.DocumentReferenceContextComponent;
import org.hl7.fhir.r4.model.Encounter;
import org.hl7.fhir.r4.model.Enumerations.DocumentReferenceStatus;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.Patient;
import org.hl7.fhir.r4.model.Reference;
import org.hl7.fhir.r4.model.Resource;
import org.hl7.fhir.r4.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Task-level access to a patient's chart: demographics, active diagnoses and prescriptions,
 * encounters, and writing documents back to an encounter.
 *
 * <p>Each operation issues one request through the {@link FhirProtocolClient}, which owns
 * authentication and retries, and maps every matching entry of the response through the
 * corresponding parser. Nothing is cached. Log messages name resource types, ids and counts only.
 */
public class ClinicalDataFacade implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(ClinicalDataFacade.class);

  public static final String DEFAULT_DOCUMENT_TYPE = "discharge_instructions";
  static final String PDF_CONTENT_TYPE = "application/pdf";
  static final String TEXT_CONTENT_TYPE = "text/plain";

  private final FhirProtocolClient client;
  private final PatientParser patientParser = new PatientParser();
  private final ConditionParser conditionParser = new ConditionParser();
  private final MedicationParser medicationParser = new MedicationParser();
  private final EncounterParser encounterParser = new EncounterParser();
  private final BarcodeParser barcodeParser = new BarcodeParser();

  public ClinicalDataFacade(FhirProtocolClient client) {
    this.client = Preconditions.checkNotNull(client);
  }

  /**
   * Looks up a patient by medical record number.
   *
   * @throws ResourceNotFoundException if no patient carries the identifier
   */
  public ParsedPatient fetchPatientByIdentifier(String identifier) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(identifier), "identifier is empty");
    String system = client.getConfiguration().getMrnIdentifierSystem();
    Bundle bundle =
        search(
            ResourceType.Patient,
            ImmutableMap.of("identifier", String.format("%s|%s", system, identifier)));
    List<Patient> patients = FhirUtil.resourcesOfType(bundle, Patient.class);
    if (patients.isEmpty()) {
      throw new ResourceNotFoundException("No patient found for the given identifier");
    }
    if (patients.size() > 1) {
      logger.warn("Identifier search matched {} patients; using the first", patients.size());
    }
    ParsedPatient patient = patientParser.parse(patients.get(0));
    logger.info("Resolved identifier to Patient/{}", patient.getId());
    return patient;
  }

  /** @throws ResourceNotFoundException if the patient does not exist */
  public ParsedPatient fetchPatientById(String patientId) {
    return patientParser.parse(read(ResourceType.Patient, patientId, Patient.class));
  }

  public List<ParsedCondition> fetchActiveConditions(String patientId) {
    FhirUtil.checkIdOrFail(patientId);
    Bundle bundle =
        search(
            ResourceType.Condition,
            ImmutableMap.of("patient", patientId, "clinical-status", "active"));
    List<ParsedCondition> conditions = Lists.newArrayList();
    for (Condition condition : FhirUtil.resourcesOfType(bundle, Condition.class)) {
      conditions.add(conditionParser.parse(condition));
    }
    logger.info("Found {} active condition(s) for Patient/{}", conditions.size(), patientId);
    return conditions;
  }

  public List<ParsedMedication> fetchActiveMedications(String patientId) {
    FhirUtil.checkIdOrFail(patientId);
    Bundle bundle =
        search(
            ResourceType.MedicationRequest,
            ImmutableMap.of("patient", patientId, "status", "active"));
    List<ParsedMedication> medications = Lists.newArrayList();
    for (MedicationRequest request : FhirUtil.resourcesOfType(bundle, MedicationRequest.class)) {
      medications.add(medicationParser.parse(request));
    }
    logger.info("Found {} active medication(s) for Patient/{}", medications.size(), patientId);
    return medications;
  }

  /** @throws ResourceNotFoundException if the encounter does not exist */
  public ParsedEncounter fetchEncounter(String encounterId) {
    return encounterParser.parse(read(ResourceType.Encounter, encounterId, Encounter.class));
  }

  public List<ParsedEncounter> fetchEncounters(String patientId) {
    FhirUtil.checkIdOrFail(patientId);
    Bundle bundle = search(ResourceType.Encounter, ImmutableMap.of("patient", patientId));
    List<ParsedEncounter> encounters = Lists.newArrayList();
    for (Encounter encounter : FhirUtil.resourcesOfType(bundle, Encounter.class)) {
      encounters.add(encounterParser.parse(encounter));
    }
    return encounters;
  }

  /**
   * Decodes a wristband barcode and looks up the patient it identifies.
   *
   * @throws ResourceNotFoundException if the decoded identifier matches no patient
   */
  public ParsedPatient scanPatientWristband(String barcode) {
    return fetchPatientByIdentifier(barcodeParser.parse(barcode));
  }

  public void submitDocument(String encounterId, String content, String format) {
    submitDocument(encounterId, content, format, DEFAULT_DOCUMENT_TYPE);
  }

  /**
   * Attaches a document to an encounter by creating a DocumentReference. The outcome is that of
   * the underlying POST; the response body is not inspected.
   *
   * @param format {@code pdf} for PDF content, anything else is sent as plain text
   */
  public void submitDocument(
      String encounterId, String content, String format, String documentType) {
    FhirUtil.checkIdOrFail(encounterId);
    Preconditions.checkNotNull(content);
    Preconditions.checkArgument(!Strings.isNullOrEmpty(documentType), "documentType is empty");

    DocumentReference document = new DocumentReference();
    document.setStatus(DocumentReferenceStatus.CURRENT);
    CodeableConcept type = new CodeableConcept();
    type.addCoding().setCode(documentType);
    document.setType(type);
    DocumentReferenceContextComponent context = new DocumentReferenceContextComponent();
    context.addEncounter(new Reference("Encounter/" + encounterId));
    document.setContext(context);
    Attachment attachment = new Attachment();
    attachment.setContentType(contentTypeFor(format));
    attachment.setData(content.getBytes(StandardCharsets.UTF_8));
    document.addContent().setAttachment(attachment);

    client.post(ResourceType.DocumentReference.name(), document);
    logger.info("Submitted {} document for Encounter/{}", documentType, encounterId);
  }

  public StatisticsReport getStatistics() {
    return client.getStatistics();
  }

  @Override
  public void close() throws IOException {
    client.close();
  }

  static String contentTypeFor(@Nullable String format) {
    if (format != null && "pdf".equals(format.toLowerCase(Locale.ROOT))) {
      return PDF_CONTENT_TYPE;
    }
    return TEXT_CONTENT_TYPE;
  }

  private Bundle search(ResourceType type, Map<String, String> params) {
    IBaseResource resource;
    try {
      resource = client.get(type.name(), params);
    } catch (ClientErrorException e) {
      if (e.isNotFound()) {
        // Some servers answer a search without matches with 404 instead of an empty bundle.
        return new Bundle();
      }
      throw e;
    }
    if (resource == null) {
      return new Bundle();
    }
    return FhirUtil.castOrFail(resource, Bundle.class);
  }

  private <T extends Resource> T read(ResourceType type, String id, Class<T> resourceClass) {
    FhirUtil.checkIdOrFail(id);
    String path = String.format("%s/%s", type.name(), id);
    IBaseResource resource;
    try {
      resource = client.get(path);
    } catch (ClientErrorException e) {
      if (e.isNotFound()) {
        throw new ResourceNotFoundException(path + " was not found", e);
      }
      throw e;
    }
    return FhirUtil.castOrFail(resource, resourceClass);
  }
}
