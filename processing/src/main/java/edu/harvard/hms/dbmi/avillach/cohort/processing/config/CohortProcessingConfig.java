package edu.harvard.hms.dbmi.avillach.cohort.processing.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the resolution engine, cache, planner and the temporal and aggregation services. The importing application must provide
 * a {@link edu.harvard.hms.dbmi.avillach.cohort.data.warehouse.WarehouseClient} bean.
 */
@Configuration
@ComponentScan("edu.harvard.hms.dbmi.avillach.cohort.processing")
public class CohortProcessingConfig {
}
