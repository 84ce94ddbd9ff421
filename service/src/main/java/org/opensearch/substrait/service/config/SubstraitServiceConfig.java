/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.substrait.service.config;

import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeFactoryImpl;
import org.opensearch.substrait.common.setting.PropertiesSettings;
import org.opensearch.substrait.common.setting.Settings;
import org.opensearch.substrait.function.FunctionCatalog;
import org.opensearch.substrait.function.FunctionCatalogLoader;
import org.opensearch.substrait.planner.calcite.CalciteRelImporter;
import org.opensearch.substrait.planner.converter.PhysicalToSubstraitPlanConverter;
import org.opensearch.substrait.planner.converter.SubstraitToPhysicalPlanConverter;
import org.opensearch.substrait.service.SubstraitPlanService;
import org.opensearch.substrait.type.SubstraitTypeSystem;
import org.opensearch.substrait.type.TypeConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SubstraitServiceConfig {

  @Autowired(required = false)
  private Settings settings;

  /** Shared, read-only catalog of the configured extension functions. */
  @Bean
  public FunctionCatalog functionCatalog() {
    return FunctionCatalogLoader.fromSettings(settings());
  }

  @Bean
  public TypeConverter typeConverter() {
    RelDataTypeFactory typeFactory = new SqlTypeFactoryImpl(SubstraitTypeSystem.INSTANCE);
    return new TypeConverter(typeFactory);
  }

  /**
   * SubstraitPlanService Bean.
   *
   * @return SubstraitPlanService.
   */
  @Bean
  public SubstraitPlanService substraitPlanService(
      TypeConverter typeConverter, FunctionCatalog functionCatalog) {
    return new SubstraitPlanService(
        new PhysicalToSubstraitPlanConverter(typeConverter, functionCatalog),
        new SubstraitToPhysicalPlanConverter(typeConverter, settings()),
        new CalciteRelImporter(typeConverter));
  }

  private Settings settings() {
    if (settings == null) {
      settings = PropertiesSettings.load();
    }
    return settings;
  }
}
