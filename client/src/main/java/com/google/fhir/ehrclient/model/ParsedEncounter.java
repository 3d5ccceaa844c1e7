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

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** A visit from a FHIR Encounter. */
@Getter
@EqualsAndHashCode
public final class ParsedEncounter {

  public static final String UNKNOWN = "Unknown";
  public static final String UNKNOWN_STATUS = "unknown";

  private final String id;
  @Nullable private final String patientId;
  private final String encounterType;
  private final ImmutableList<String> typeDescriptions;
  @Nullable private final String location;
  @Nullable private final Instant start;
  @Nullable private final Instant end;
  private final String status;

  private ParsedEncounter(Builder builder) {
    this.id = builder.id;
    this.patientId = builder.patientId;
    this.encounterType = builder.encounterType;
    this.typeDescriptions = ImmutableList.copyOf(builder.typeDescriptions);
    this.location = builder.location;
    this.start = builder.start;
    this.end = builder.end;
    this.status = builder.status;
  }

  @Override
  public String toString() {
    return "ParsedEncounter{id=" + id + ", status=" + status + "}";
  }

  public static class Builder {
    private String id = "";
    private String patientId;
    private String encounterType = UNKNOWN;
    private List<String> typeDescriptions = ImmutableList.of();
    private String location;
    private Instant start;
    private Instant end;
    private String status = UNKNOWN_STATUS;

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setPatientId(@Nullable String patientId) {
      this.patientId = patientId;
      return this;
    }

    public Builder setEncounterType(String encounterType) {
      this.encounterType = encounterType;
      return this;
    }

    public Builder setTypeDescriptions(List<String> typeDescriptions) {
      this.typeDescriptions = typeDescriptions;
      return this;
    }

    public Builder setLocation(@Nullable String location) {
      this.location = location;
      return this;
    }

    public Builder setStart(@Nullable Instant start) {
      this.start = start;
      return this;
    }

    public Builder setEnd(@Nullable Instant end) {
      this.end = end;
      return this;
    }

    public Builder setStatus(String status) {
      this.status = status;
      return this;
    }

    public ParsedEncounter build() {
      return new ParsedEncounter(this);
    }
  }
}
