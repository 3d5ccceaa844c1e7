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

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the patient identifier printed on a wristband barcode. Recognised encodings are plain
 * digits, a {@code MRN:} prefix, and caret-delimited fields where the field after an {@code MRN}
 * marker holds the identifier, e.g. {@code PID^MRN^12345678}. Anything else is returned as is and
 * left to the server lookup to reject.
 */
public class BarcodeParser {

  private static final Logger logger = LoggerFactory.getLogger(BarcodeParser.class);

  private static final Pattern DIGITS_PATTERN = Pattern.compile("\\d+");
  private static final Pattern MRN_PREFIX_PATTERN =
      Pattern.compile("^MRN:\\s*(.+)$", Pattern.CASE_INSENSITIVE);
  private static final String MRN_MARKER = "MRN";

  public String parse(String barcode) {
    Preconditions.checkNotNull(barcode);
    String trimmed = barcode.trim();

    if (DIGITS_PATTERN.matcher(trimmed).matches()) {
      return trimmed;
    }

    Matcher prefixed = MRN_PREFIX_PATTERN.matcher(trimmed);
    if (prefixed.matches()) {
      return prefixed.group(1).trim();
    }

    if (trimmed.contains("^")) {
      List<String> fields = Splitter.on('^').trimResults().splitToList(trimmed);
      for (int i = 0; i + 1 < fields.size(); i++) {
        if (MRN_MARKER.equals(fields.get(i).toUpperCase(Locale.ROOT))
            && !fields.get(i + 1).isEmpty()) {
          return fields.get(i + 1);
        }
      }
    }

    logger.debug("Barcode is in no recognised format; using it unmodified");
    return barcode;
  }
}
