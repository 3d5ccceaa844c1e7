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
package com.google.fhir.ehrclient.exec;

import com.google.common.annotations.VisibleForTesting;
import com.google.fhir.ehrclient.ClinicalApiException;
import com.google.fhir.ehrclient.ClinicalClientFactory;
import com.google.fhir.ehrclient.ClinicalDataFacade;
import com.google.fhir.ehrclient.model.ParsedCondition;
import com.google.fhir.ehrclient.model.ParsedMedication;
import com.google.fhir.ehrclient.model.ParsedPatient;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sample command line application: decodes a wristband barcode, looks the patient up and prints
 * how many active conditions and medications are on file, followed by the client statistics.
 *
 * <p>The FHIR server and credentials are taken from the environment variables read by {@link
 * ClinicalClientFactory}. Clinical content itself is never printed.
 */
public class MainApp {

  private static final Logger logger = LoggerFactory.getLogger(MainApp.class);

  public static void main(String[] args) throws IOException {
    if (args.length != 1) {
      System.err.println("Usage: MainApp <barcode>");
      System.exit(2);
    }
    int exitCode;
    try (ClinicalDataFacade facade = ClinicalClientFactory.createFacadeFromEnvVars()) {
      exitCode = run(facade, args[0], System.out);
    }
    System.exit(exitCode);
  }

  @VisibleForTesting
  static int run(ClinicalDataFacade facade, String barcode, PrintStream out) {
    try {
      ParsedPatient patient = facade.scanPatientWristband(barcode);
      List<ParsedCondition> conditions = facade.fetchActiveConditions(patient.getId());
      List<ParsedMedication> medications = facade.fetchActiveMedications(patient.getId());
      out.printf(
          "Patient/%s: %d active condition(s), %d active medication(s)%n",
          patient.getId(), conditions.size(), medications.size());
      return 0;
    } catch (ClinicalApiException | IllegalArgumentException e) {
      logger.error("Patient lookup failed", e);
      out.println("Patient lookup failed: " + e.getClass().getSimpleName());
      return 1;
    } finally {
      out.println(facade.getStatistics().toJson());
    }
  }
}
