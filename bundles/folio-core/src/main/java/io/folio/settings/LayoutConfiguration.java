/*
 * Copyright (c) 2023, Folio Contributors
 *
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *     * Redistributions of source code must retain the above copyright
 *       notice, this list of conditions and the following disclaimer.
 *     * Redistributions in binary form must reproduce the above copyright
 *       notice, this list of conditions and the following disclaimer in the
 *       documentation and/or other materials provided with the distribution.
 *     * Neither the name of the <organization> nor the
 *       names of its contributors may be used to endorse or promote products
 *       derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.folio.settings;

import com.google.common.base.MoreObjects;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.folio.exception.FolioConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Holds the document-level names the decoration layer relies on: which element is the document
 * body, which synthetic element carries generated content, and under which attribute a copied
 * element keeps the {@code id} it had to give up.
 *
 * <p>
 * Instances are immutable and created through {@link #newBuilder()}. They can be persisted as a
 * small JSON document with {@link #serialize(LayoutConfiguration, Path)}.
 * </p>
 */
public final class LayoutConfiguration {

  // FIXED STANDARD FIELDS
  private static final String BODY_TAG = "body";

  private static final String GENERATED_CONTENT_TAG = "folio-generated";

  private static final String ORIGINAL_ID_ATTRIBUTE = "data-folio-original-id";

  private static final boolean PARENT_LOOKUP_CACHE = true;
  // END FIXED STANDARD FIELDS

  private static final String[] JSONNAMES =
      { "bodyTag", "generatedContentTag", "originalIdAttribute", "parentLookupCache" };

  private static final LayoutConfiguration DEFAULTS = newBuilder().build();

  /** Node name of the document body, whose box edges are never truncated on a split. */
  private final String bodyTag;

  /** Node name of synthetic frames holding generated content. */
  private final String generatedContentTag;

  /** Attribute under which a copied element keeps its former {@code id}. */
  private final String originalIdAttribute;

  /** Whether {@code getParent()} caches its lookup by default. */
  private final boolean parentLookupCache;

  private LayoutConfiguration(final Builder builder) {
    bodyTag = builder.bodyTag;
    generatedContentTag = builder.generatedContentTag;
    originalIdAttribute = builder.originalIdAttribute;
    parentLookupCache = builder.parentLookupCache;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * The configuration used when nothing else is specified.
   *
   * @return the default configuration
   */
  public static LayoutConfiguration defaults() {
    return DEFAULTS;
  }

  public String getBodyTag() {
    return bodyTag;
  }

  public String getGeneratedContentTag() {
    return generatedContentTag;
  }

  public String getOriginalIdAttribute() {
    return originalIdAttribute;
  }

  public boolean isParentLookupCacheEnabled() {
    return parentLookupCache;
  }

  /**
   * Write the configuration to {@code file} as JSON.
   *
   * @param config the configuration to write
   * @param file target file, created or truncated
   * @throws FolioConfigurationException if the file cannot be written
   */
  public static void serialize(final LayoutConfiguration config, final Path file)
      throws FolioConfigurationException {
    requireNonNull(config);
    try (final Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
         final JsonWriter jsonWriter = new JsonWriter(writer)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();
      jsonWriter.name(JSONNAMES[0]).value(config.bodyTag);
      jsonWriter.name(JSONNAMES[1]).value(config.generatedContentTag);
      jsonWriter.name(JSONNAMES[2]).value(config.originalIdAttribute);
      jsonWriter.name(JSONNAMES[3]).value(config.parentLookupCache);
      jsonWriter.endObject();
    } catch (final IOException e) {
      throw new FolioConfigurationException(e);
    }
  }

  /**
   * Read a configuration written by {@link #serialize(LayoutConfiguration, Path)}. Missing names
   * keep their default value, unknown names are rejected.
   *
   * @param file the JSON file
   * @return the configuration
   * @throws FolioConfigurationException if the file cannot be read or is malformed
   */
  public static LayoutConfiguration deserialize(final Path file) throws FolioConfigurationException {
    try (final Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
         final JsonReader jsonReader = new JsonReader(reader)) {
      final Builder builder = newBuilder();
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        final String name = jsonReader.nextName();
        if (JSONNAMES[0].equals(name)) {
          builder.bodyTag(jsonReader.nextString());
        } else if (JSONNAMES[1].equals(name)) {
          builder.generatedContentTag(jsonReader.nextString());
        } else if (JSONNAMES[2].equals(name)) {
          builder.originalIdAttribute(jsonReader.nextString());
        } else if (JSONNAMES[3].equals(name)) {
          builder.parentLookupCache(jsonReader.nextBoolean());
        } else {
          throw new FolioConfigurationException("Unknown configuration entry '%s' in %s", name, file);
        }
      }
      jsonReader.endObject();
      if (jsonReader.peek() != JsonToken.END_DOCUMENT) {
        throw new FolioConfigurationException("Trailing content after configuration object in %s", file);
      }
      return builder.build();
    } catch (final IOException | IllegalStateException | IllegalArgumentException e) {
      throw new FolioConfigurationException(e);
    }
  }

  @Override
  public boolean equals(final Object obj) {
    if (!(obj instanceof LayoutConfiguration)) {
      return false;
    }
    final LayoutConfiguration other = (LayoutConfiguration) obj;
    return bodyTag.equals(other.bodyTag) && generatedContentTag.equals(other.generatedContentTag)
        && originalIdAttribute.equals(other.originalIdAttribute) && parentLookupCache == other.parentLookupCache;
  }

  @Override
  public int hashCode() {
    return Objects.hash(bodyTag, generatedContentTag, originalIdAttribute, parentLookupCache);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("bodyTag", bodyTag)
                      .add("generatedContentTag", generatedContentTag)
                      .add("originalIdAttribute", originalIdAttribute)
                      .add("parentLookupCache", parentLookupCache)
                      .toString();
  }

  /**
   * Builder setting up a {@link LayoutConfiguration}.
   */
  public static final class Builder {

    private String bodyTag = BODY_TAG;

    private String generatedContentTag = GENERATED_CONTENT_TAG;

    private String originalIdAttribute = ORIGINAL_ID_ATTRIBUTE;

    private boolean parentLookupCache = PARENT_LOOKUP_CACHE;

    private Builder() {
    }

    public Builder bodyTag(final String bodyTag) {
      this.bodyTag = checkName(bodyTag);
      return this;
    }

    public Builder generatedContentTag(final String generatedContentTag) {
      this.generatedContentTag = checkName(generatedContentTag);
      return this;
    }

    public Builder originalIdAttribute(final String originalIdAttribute) {
      this.originalIdAttribute = checkName(originalIdAttribute);
      checkArgument(!"id".equals(originalIdAttribute), "The original id must not be kept under 'id' itself!");
      return this;
    }

    public Builder parentLookupCache(final boolean parentLookupCache) {
      this.parentLookupCache = parentLookupCache;
      return this;
    }

    public LayoutConfiguration build() {
      return new LayoutConfiguration(this);
    }

    private static String checkName(final String name) {
      requireNonNull(name);
      checkArgument(!name.isBlank(), "Names must not be blank!");
      return name;
    }
  }
}
