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

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.parser.DataFormatException;
import ca.uhn.fhir.parser.IParser;
import ca.uhn.fhir.parser.LenientErrorHandler;
import com.google.common.collect.Lists;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Bundle.BundleEntryComponent;
import org.hl7.fhir.r4.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FhirUtil {

  private static final Logger logger = LoggerFactory.getLogger(FhirUtil.class);

  // This is based on https://www.hl7.org/fhir/datatypes.html#id
  private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9\\-.]{1,64}");

  /**
   * Creates an R4 context whose parser keeps coded values it does not recognize, e.g. a Patient
   * gender of {@code "M"}, as raw strings instead of rejecting the whole payload.
   */
  public static FhirContext createFhirContext() {
    FhirContext fhirContext = FhirContext.forR4();
    // Parser warnings may quote element values, so they are not logged.
    LenientErrorHandler errorHandler = new LenientErrorHandler(false);
    errorHandler.setErrorOnInvalidValue(false);
    fhirContext.setParserErrorHandler(errorHandler);
    return fhirContext;
  }

  public static boolean isValidId(@Nullable String id) {
    return id != null && ID_PATTERN.matcher(id).matches();
  }

  public static String checkIdOrFail(@Nullable String idPart) {
    if (!isValidId(idPart)) {
      ExceptionUtil.throwRuntimeExceptionAndLog(
          logger, String.format("ID %s is invalid!", idPart), IllegalArgumentException.class);
    }
    return idPart; // This is for convenience.
  }

  /**
   * Parses a JSON payload into a FHIR R4 resource.
   *
   * @throws ResourceParseException if the payload is not a FHIR resource at all
   */
  public static IBaseResource parseResource(FhirContext fhirContext, String json) {
    IParser jsonParser = fhirContext.newJsonParser();
    try {
      return jsonParser.parseResource(json);
    } catch (DataFormatException e) {
      // The message of a DataFormatException may quote the payload, so it is not logged.
      ExceptionUtil.throwRuntimeExceptionAndLog(
          logger, "Response body is not a FHIR resource", ResourceParseException.class);
      return null; // Unreachable.
    }
  }

  /**
   * Returns {@code resource} as {@code type}.
   *
   * @throws ResourceParseException if the resource is missing or of another type
   */
  public static <T extends Resource> T castOrFail(
      @Nullable IBaseResource resource, Class<T> type) {
    if (!type.isInstance(resource)) {
      ExceptionUtil.throwRuntimeExceptionAndLog(
          logger,
          String.format(
              "Expected a %s resource but got %s",
              type.getSimpleName(), resource == null ? "an empty body" : resource.fhirType()),
          ResourceParseException.class);
    }
    return type.cast(resource);
  }

  /** Collects the entries of a search result bundle that are of the given type. */
  public static <T extends Resource> List<T> resourcesOfType(Bundle bundle, Class<T> type) {
    List<T> resources = Lists.newArrayList();
    for (BundleEntryComponent entry : bundle.getEntry()) {
      if (entry.hasResource() && type.isInstance(entry.getResource())) {
        resources.add(type.cast(entry.getResource()));
      }
    }
    return resources;
  }

  /** Returns the id part of a reference like {@code Patient/123}, or null if it has none. */
  @Nullable
  public static String referencedIdOrNull(@Nullable String reference) {
    if (reference == null || reference.isEmpty()) {
      return null;
    }
    int slash = reference.lastIndexOf('/');
    String idPart = slash < 0 ? reference : reference.substring(slash + 1);
    return idPart.isEmpty() ? null : idPart;
  }
}
