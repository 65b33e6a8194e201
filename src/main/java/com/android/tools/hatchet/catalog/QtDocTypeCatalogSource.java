// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.hatchet.catalog;

import com.android.tools.hatchet.utils.IdentifierUtils;
import com.android.tools.hatchet.utils.StringUtils;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@link TypeCatalogSource} that scrapes the toolkit's HTML reference documentation.
 *
 * <p>The documentation has an index page {@code classes.html} and for every type a description
 * page {@code <type>.html} and a member list page {@code <type>-members.html}, with the type name
 * in lower case. A type is known if it has a member list page.
 *
 * <p>A few facts are missing from the documentation and are added here.
 */
public class QtDocTypeCatalogSource implements TypeCatalogSource {

  public static final String INDEX_PAGE = "classes.html";

  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern CLASS_LINK = Pattern.compile("<a href=\"(\\w+).html\">(\\w+)</a>");
  private static final Pattern MEMBER_LINK =
      Pattern.compile("<a href=\"(\\w+).html#([\\w\\-.]+)\">(\\w+)</a>");
  private static final Pattern WORD_SEPARATOR = Pattern.compile("[^A-Za-z0-9:]+");

  private static final String MEMBER_LINE_PREFIX = "<li class=\"fn\">";
  private static final String SUMMARY_LINE_PREFIX = "<tr><td class=\"memItemLeft ";

  private static final String TEXT_STREAM_MANIPULATOR = "QTextStreamManipulator";
  private static final String SCRIPT_EXTENSION_INTERFACE = "QScriptExtensionInterface";
  private static final String ABSTRACT_ITEM_MODEL = "QAbstractItemModel";

  private static final ImmutableSet<String> UNDOCUMENTED_TYPES =
      ImmutableSet.of(TEXT_STREAM_MANIPULATOR, SCRIPT_EXTENSION_INTERFACE);
  private static final ImmutableList<String> UNDOCUMENTED_ITEM_MODEL_MEMBERS =
      ImmutableList.of("decodeData", "encodeData");

  private final DocumentationSource documentation;
  private final Map<String, Optional<String>> pages = new HashMap<>();

  public QtDocTypeCatalogSource(DocumentationSource documentation) {
    this.documentation = documentation;
  }

  private String readPage(String name) {
    return pages
        .computeIfAbsent(
            name,
            page -> {
              try {
                return Optional.ofNullable(documentation.readPage(page));
              } catch (IOException e) {
                throw new CatalogException(
                    "Failed to read documentation page: " + e.getMessage(),
                    documentation.getOrigin(page),
                    e);
              }
            })
        .orElse(null);
  }

  private List<String> readPageLines(String name) {
    String page = readPage(name);
    if (page == null) {
      return Collections.emptyList();
    }
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (String line : StringUtils.splitLines(page)) {
      builder.add(line.trim());
    }
    return builder.build();
  }

  private static String descriptionPage(String type) {
    return StringUtils.toLowerCase(type) + ".html";
  }

  private static String memberListPage(String type) {
    return StringUtils.toLowerCase(type) + "-members.html";
  }

  @Override
  public Collection<String> allTypes() {
    String index = readPage(INDEX_PAGE);
    if (index == null) {
      throw new CatalogException(
          "Missing documentation index page", documentation.getOrigin(INDEX_PAGE));
    }
    Set<String> types = new LinkedHashSet<>(UNDOCUMENTED_TYPES);
    for (String line : readPageLines(INDEX_PAGE)) {
      if (line.startsWith("<dd>")) {
        List<String> linked = linkedTypes(line);
        if (!linked.isEmpty()) {
          types.add(linked.get(0));
        }
      }
    }
    return types;
  }

  @Override
  public boolean isType(String name) {
    if (UNDOCUMENTED_TYPES.contains(name)) {
      return true;
    }
    return IdentifierUtils.isIdentifier(name) && readPage(memberListPage(name)) != null;
  }

  @Override
  public Collection<String> directSupertypeNames(String type) {
    return linkedTypesOnLines(type, "Inherits");
  }

  @Override
  public Collection<String> directSubtypeNames(String type) {
    return linkedTypesOnLines(type, "Inherited by");
  }

  private Collection<String> linkedTypesOnLines(String type, String marker) {
    Set<String> result = new LinkedHashSet<>();
    for (String line : readPageLines(descriptionPage(type))) {
      if (line.contains(marker)) {
        result.addAll(linkedTypes(line));
      }
    }
    return result;
  }

  @Override
  public Collection<String> members(String type) {
    if (type.equals(SCRIPT_EXTENSION_INTERFACE)) {
      return Collections.singletonList("initialize");
    }
    Set<String> result = new LinkedHashSet<>();
    if (type.equals(ABSTRACT_ITEM_MODEL)) {
      result.addAll(UNDOCUMENTED_ITEM_MODEL_MEMBERS);
    }
    for (String line : readPageLines(memberListPage(type))) {
      if (line.startsWith(MEMBER_LINE_PREFIX)) {
        Matcher matcher = MEMBER_LINK.matcher(line);
        while (matcher.find()) {
          // Links to other things than the member itself do not have the name in their anchor.
          if (matcher.group(2).contains(matcher.group(3))) {
            result.add(matcher.group(3));
          }
        }
      }
    }
    return result;
  }

  @Override
  public Collection<String> relatedTypeNames(String type, String member) {
    if (type.equals(SCRIPT_EXTENSION_INTERFACE)) {
      return member.equals("initialize")
          ? Collections.singletonList("QScriptEngine")
          : Collections.emptyList();
    }
    // Only the undocumented members have fixed answers. The documented members of the model
    // are scanned like those of any other type, so the types in their signatures stay useful.
    if (type.equals(ABSTRACT_ITEM_MODEL) && UNDOCUMENTED_ITEM_MODEL_MEMBERS.contains(member)) {
      return ImmutableList.of("QModelIndexList", "QDataStream");
    }
    Set<String> result = new LinkedHashSet<>();
    String memberLink = ">" + member + "<";
    for (String line : readPageLines(memberListPage(type))) {
      if (line.startsWith(MEMBER_LINE_PREFIX) && line.contains(memberLink)) {
        String signature = TAG.matcher(line).replaceAll(" ");
        for (String word : WORD_SEPARATOR.split(signature)) {
          int scope = word.indexOf("::");
          if (scope >= 0) {
            word = word.substring(0, scope);
          }
          if (!word.isEmpty()
              && StringUtils.isAlphanumeric(word)
              && Character.isUpperCase(word.charAt(0))) {
            result.add(word);
          }
        }
      }
    }
    return result;
  }

  @Override
  public boolean isPureVirtual(String type, String member) {
    String memberLink = ">" + member + "<";
    for (String line : readPageLines(descriptionPage(type))) {
      if (line.startsWith(SUMMARY_LINE_PREFIX)
          && line.contains(memberLink)
          && line.contains("= 0</td>")) {
        return true;
      }
    }
    return false;
  }

  /**
   * Resolves a name found in the documentation. Template parameters are dropped and list aliases
   * such as {@code QModelIndexList} resolve to the element type and the list type.
   */
  @Override
  public Collection<String> resolveTypeName(String name) {
    if (isType(name)) {
      return Collections.singletonList(name);
    }
    if (name.equals("T")) {
      return Collections.emptyList();
    }
    if (name.endsWith("List") && name.length() > "List".length()) {
      return ImmutableList.of(StringUtils.stripSuffix(name, "List"), "QList");
    }
    return Collections.emptyList();
  }

  private static List<String> linkedTypes(String line) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    Matcher matcher = CLASS_LINK.matcher(line);
    while (matcher.find()) {
      if (matcher.group(1).equals(StringUtils.toLowerCase(matcher.group(2)))) {
        builder.add(matcher.group(2));
      }
    }
    return builder.build();
  }
}
