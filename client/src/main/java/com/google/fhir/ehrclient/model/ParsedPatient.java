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

import com.google.common.base.Joiner;
import java.time.LocalDate;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Demographic summary of a FHIR Patient. Missing names are empty strings, never null. */
@Getter
@EqualsAndHashCode
public final class ParsedPatient {

  private final String id;
  @Nullable private final String mrn;
  @Nullable private final String mrnSystem;
  private final String givenName;
  private final String familyName;
  @Nullable private final LocalDate birthDate;
  @Nullable private final String gender;

  private ParsedPatient(Builder builder) {
    this.id = builder.id;
    this.mrn = builder.mrn;
    this.mrnSystem = builder.mrnSystem;
    this.givenName = builder.givenName;
    this.familyName = builder.familyName;
    this.birthDate = builder.birthDate;
    this.gender = builder.gender;
  }

  /** Given and family name separated by a space; empty parts are skipped. */
  public String getFullName() {
    return Joiner.on(' ').skipNulls().join(emptyToNull(givenName), emptyToNull(familyName));
  }

  @Nullable
  private static String emptyToNull(String value) {
    return value.isEmpty() ? null : value;
  }

  @Override
  public String toString() {
    return "ParsedPatient{id=" + id + "}";
  }

  public static class Builder {
    private String id;
    private String mrn;
    private String mrnSystem;
    private String givenName = "";
    private String familyName = "";
    private LocalDate birthDate;
    private String gender;

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setMrn(@Nullable String mrn) {
      this.mrn = mrn;
      return this;
    }

    public Builder setMrnSystem(@Nullable String mrnSystem) {
      this.mrnSystem = mrnSystem;
      return this;
    }

    public Builder setGivenName(String givenName) {
      this.givenName = givenName;
      return this;
    }

    public Builder setFamilyName(String familyName) {
      this.familyName = familyName;
      return this;
    }

    public Builder setBirthDate(@Nullable LocalDate birthDate) {
      this.birthDate = birthDate;
      return this;
    }

    public Builder setGender(@Nullable String gender) {
      this.gender = gender;
      return this;
    }

    public ParsedPatient build() {
      if (id == null) {
        id = "";
      }
      if (givenName == null) {
        givenName = "";
      }
      if (familyName == null) {
        familyName = "";
      }
      return new ParsedPatient(this);
    }
  }
}
