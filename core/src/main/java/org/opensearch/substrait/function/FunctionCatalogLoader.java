/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.function;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.substrait.common.setting.Settings;
import org.opensearch.substrait.exception.FunctionCatalogException;
import org.opensearch.substrait.function.extension.SimpleExtension;

/** Builds a {@link FunctionCatalog} from Substrait simple extension YAML documents. */
@Log4j2
public class FunctionCatalogLoader {

  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final List<FunctionVariant> variants = new ArrayList<>();

  /** Loads the extension files named by {@link Settings.Key#FUNCTION_EXTENSION_FILES}. */
  public static FunctionCatalog fromSettings(Settings settings) {
    List<String> resources = settings.getSettingValue(Settings.Key.FUNCTION_EXTENSION_FILES);
    return fromResources(resources);
  }

  /** Loads classpath resources, each one becoming an extension with URI {@code /<resource>}. */
  public static FunctionCatalog fromResources(List<String> resources) {
    FunctionCatalogLoader loader = new FunctionCatalogLoader();
    for (String resource : resources) {
      loader.loadResource(resource);
    }
    FunctionCatalog catalog = loader.build();
    log.info(
        "Loaded {} function variants from {} extension files",
        catalog.size(),
        resources.size());
    return catalog;
  }

  public FunctionCatalogLoader loadResource(String resource) {
    String path = resource.startsWith("/") ? resource.substring(1) : resource;
    try (InputStream in = FunctionCatalogLoader.class.getClassLoader().getResourceAsStream(path)) {
      if (in == null) {
        throw new FunctionCatalogException("Function extension " + resource + " not found");
      }
      return load("/" + path, in);
    } catch (IOException e) {
      throw new FunctionCatalogException("Failed to read function extension " + resource, e);
    }
  }

  public FunctionCatalogLoader load(String uri, InputStream in) {
    SimpleExtension extension;
    try {
      extension = YAML_MAPPER.readValue(in, SimpleExtension.class);
    } catch (IOException e) {
      log.error("Malformed function extension {}", uri, e);
      throw new FunctionCatalogException("Malformed function extension " + uri, e);
    }
    add(uri, extension);
    return this;
  }

  public FunctionCatalog build() {
    return new FunctionCatalog(variants);
  }

  @VisibleForTesting
  void add(String uri, SimpleExtension extension) {
    if (extension == null) {
      throw new FunctionCatalogException("Function extension " + uri + " is empty");
    }
    for (SimpleExtension.FunctionDefinition function : extension.getScalarFunctions()) {
      addFunction(uri, function, false);
    }
    for (SimpleExtension.FunctionDefinition function : extension.getAggregateFunctions()) {
      addFunction(uri, function, true);
    }
  }

  private void addFunction(String uri, SimpleExtension.FunctionDefinition function, boolean agg) {
    if (Strings.isNullOrEmpty(function.getName())) {
      throw new FunctionCatalogException("Function without name in " + uri);
    }
    for (SimpleExtension.Implementation impl : function.getImpls()) {
      if (Strings.isNullOrEmpty(impl.getReturnType())) {
        throw new FunctionCatalogException(
            String.format("Function %s in %s has no return type", function.getName(), uri));
      }
      List<ArgumentSpec> arguments = new ArrayList<>();
      for (SimpleExtension.Argument argument : impl.getArgs()) {
        arguments.add(toArgumentSpec(uri, function.getName(), argument));
      }
      SimpleExtension.Variadic variadic = impl.getVariadic();
      variants.add(
          new FunctionVariant(
              function.getName(),
              uri,
              arguments,
              lastLine(impl.getReturnType()),
              impl.getIntermediate(),
              agg,
              variadic == null ? null : (variadic.getMin() == null ? 0 : variadic.getMin()),
              variadic == null ? null : variadic.getMax()));
    }
  }

  private static ArgumentSpec toArgumentSpec(
      String uri, String function, SimpleExtension.Argument argument) {
    if (argument.getOptions() != null) {
      return ArgumentSpec.enumeration(
          argument.getOptions(), argument.getRequired() == null || argument.getRequired());
    }
    if (Strings.isNullOrEmpty(argument.getValue())) {
      throw new FunctionCatalogException(
          String.format("Argument of %s in %s has neither value nor options", function, uri));
    }
    return ArgumentSpec.value(argument.getValue());
  }

  /** Multi-line return derivations end with the resulting type. */
  private static String lastLine(String returnType) {
    String[] lines = returnType.trim().split("\\R");
    return lines[lines.length - 1].trim();
  }
}
