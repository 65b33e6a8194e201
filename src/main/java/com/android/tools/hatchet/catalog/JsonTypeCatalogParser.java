// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import com.android.tools.hatchet.origin.Origin;
import com.android.tools.hatchet.origin.PathOrigin;
import com.android.tools.hatchet.utils.StringUtils;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Loads a type catalog from its JSON interchange form:
 *
 * <pre>
 * {
 *   "types": [
 *     {
 *       "name": "QWidget",
 *       "supertypes": ["QObject", "QPaintDevice"],
 *       "members": [
 *         {"name": "setLayout", "kind": "function", "relatedTypes": ["QLayout"]},
 *         {"name": "paintEngine", "kind": "function", "pureVirtual": true}
 *       ]
 *     }
 *   ],
 *   "aliases": {"QWidgetList": ["QList", "QWidget"]}
 * }
 * </pre>
 */
public class JsonTypeCatalogParser {

  public static InMemoryTypeCatalogSource parse(Path path) {
    Origin origin = new PathOrigin(path);
    String json;
    try {
      json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CatalogException("Failed to read type catalog: " + e.getMessage(), origin, e);
    }
    return parse(json, origin);
  }

  public static InMemoryTypeCatalogSource parse(String json, Origin origin) {
    CatalogJson catalog;
    try {
      catalog =
          new GsonBuilder()
              .excludeFieldsWithoutExposeAnnotation()
              .create()
              .fromJson(json, CatalogJson.class);
    } catch (JsonParseException e) {
      throw new CatalogException("Malformed type catalog: " + e.getMessage(), origin, e);
    }
    if (catalog == null) {
      throw new CatalogException("Empty type catalog", origin);
    }
    InMemoryTypeCatalogSource.Builder builder = InMemoryTypeCatalogSource.builder();
    for (TypeJson type : nonNull(catalog.types)) {
      if (type == null || type.name == null) {
        throw new CatalogException("Type without a name in type catalog", origin);
      }
      builder.addType(type.name, nonNull(type.supertypes));
      for (MemberJson member : nonNull(type.members)) {
        if (member == null || member.name == null) {
          throw new CatalogException("Member without a name on type " + type.name, origin);
        }
        builder.addMember(
            type.name,
            member.name,
            parseKind(member.kind, type.name + "." + member.name, origin),
            member.pureVirtual,
            nonNull(member.relatedTypes));
      }
    }
    if (catalog.aliases != null) {
      catalog.aliases.forEach((alias, names) -> builder.addAlias(alias, nonNull(names)));
    }
    return builder.build();
  }

  private static MemberKind parseKind(String kind, String member, Origin origin) {
    if (kind == null) {
      return MemberKind.UNKNOWN;
    }
    switch (StringUtils.toLowerCase(kind)) {
      case "field":
        return MemberKind.FIELD;
      case "function":
        return MemberKind.FUNCTION;
      case "unknown":
        return MemberKind.UNKNOWN;
      default:
        throw new CatalogException("Invalid member kind '" + kind + "' for " + member, origin);
    }
  }

  private static <T> List<T> nonNull(List<T> list) {
    return list != null ? list : Collections.emptyList();
  }

  private static class CatalogJson {

    @Expose
    @SerializedName("types")
    private List<TypeJson> types;

    @Expose
    @SerializedName("aliases")
    private Map<String, List<String>> aliases;
  }

  private static class TypeJson {

    @Expose
    @SerializedName("name")
    private String name;

    @Expose
    @SerializedName("supertypes")
    private List<String> supertypes;

    @Expose
    @SerializedName("members")
    private List<MemberJson> members;
  }

  private static class MemberJson {

    @Expose
    @SerializedName("name")
    private String name;

    @Expose
    @SerializedName("kind")
    private String kind;

    @Expose
    @SerializedName("relatedTypes")
    private List<String> relatedTypes;

    @Expose
    @SerializedName("pureVirtual")
    private boolean pureVirtual;
  }
}
