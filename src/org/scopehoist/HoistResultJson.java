/*
 * Copyright 2026 The Scope Hoist Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.scopehoist;

import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Writes a {@link HoistResult} as a JSON object, for bundlers that don't run on the JVM. */
public final class HoistResultJson {

  private HoistResultJson() {}

  public static String toJson(HoistResult result, @Nullable List<Bailout> bailouts) {
    StringWriter out = new StringWriter();
    try {
      write(result, bailouts, out, false);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  /**
   * Writes {@code result} to {@code out}. Bailouts are written only when non-null, so that an
   * untraced result has no {@code bailouts} member at all.
   */
  public static void write(
      HoistResult result, @Nullable List<Bailout> bailouts, Writer out, boolean prettyPrint)
      throws IOException {
    JsonWriter jsonWriter = new JsonWriter(out);
    if (prettyPrint) {
      jsonWriter.setIndent("  ");
    }

    jsonWriter.beginObject();
    writeImports(jsonWriter.name("importedSymbols"), result.importedSymbols());

    jsonWriter.name("exportedSymbols").beginArray();
    for (ExportedSymbol symbol : result.exportedSymbols()) {
      jsonWriter.beginObject();
      jsonWriter.name("local").value(symbol.local());
      jsonWriter.name("exported").value(symbol.exported());
      writeLocation(jsonWriter.name("loc"), symbol.loc());
      jsonWriter.endObject();
    }
    jsonWriter.endArray();

    writeImports(jsonWriter.name("reExports"), result.reExports());
    writeStrings(jsonWriter.name("selfReferences"), result.selfReferences());
    writeStrings(jsonWriter.name("wrappedRequires"), result.wrappedRequires());

    jsonWriter.name("dynamicImports").beginObject();
    for (Map.Entry<String, String> entry : result.dynamicImports().entrySet()) {
      jsonWriter.name(entry.getKey()).value(entry.getValue());
    }
    jsonWriter.endObject();

    jsonWriter.name("staticCjsExports").value(result.staticCjsExports());
    jsonWriter.name("hasCjsExports").value(result.hasCjsExports());
    jsonWriter.name("isEsm").value(result.isEsm());
    jsonWriter.name("shouldWrap").value(result.shouldWrap());

    if (bailouts != null) {
      jsonWriter.name("bailouts").beginArray();
      for (Bailout bailout : bailouts) {
        jsonWriter.beginObject();
        jsonWriter.name("key").value(bailout.reason().diagnosticType().key);
        jsonWriter.name("message").value(bailout.reason().message());
        writeLocation(jsonWriter.name("loc"), bailout.loc());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
    }
    jsonWriter.endObject();
    jsonWriter.flush();
  }

  private static void writeImports(JsonWriter jsonWriter, List<ImportedSymbol> symbols)
      throws IOException {
    jsonWriter.beginArray();
    for (ImportedSymbol symbol : symbols) {
      jsonWriter.beginObject();
      jsonWriter.name("source").value(symbol.source());
      jsonWriter.name("local").value(symbol.local());
      jsonWriter.name("imported").value(symbol.imported());
      writeLocation(jsonWriter.name("loc"), symbol.loc());
      jsonWriter.endObject();
    }
    jsonWriter.endArray();
  }

  private static void writeStrings(JsonWriter jsonWriter, Iterable<String> values)
      throws IOException {
    jsonWriter.beginArray();
    for (String value : values) {
      jsonWriter.value(value);
    }
    jsonWriter.endArray();
  }

  private static void writeLocation(JsonWriter jsonWriter, SourceLocation loc)
      throws IOException {
    jsonWriter.beginObject();
    jsonWriter.name("source").value(loc.sourceName());
    jsonWriter.name("line").value(loc.line());
    jsonWriter.name("column").value(loc.column());
    jsonWriter.name("length").value(loc.length());
    jsonWriter.endObject();
  }
}
