package ca.gc.cra.prism.application.metrics;

/**
 * Metric names emitted by the collector.
 *
 * @since 0.1.0
 */
public final class MetricNames {
  public static final String AGENT_ACTIONS = "agent_actions_total";
  public static final String AGENT_ERRORS = "agent_errors_total";
  public static final String AGENT_THINK_TIME = "agent_think_time_ms";
  public static final String AGENT_RESPONSE_TIME = "agent_response_time_ms";

  public static final String PORTAL_REQUESTS = "portal_requests_total";
  public static final String PORTAL_ERRORS = "portal_errors_total";
  public static final String PORTAL_REQUEST_DURATION = "portal_request_duration_ms";
  public static final String PORTAL_TOKENS = "portal_tokens_used_total";

  public static final String EXTENSION_MESSAGES = "extension_messages_total";
  public static final String EXTENSION_ERRORS = "extension_errors_total";
  public static final String EXTENSION_LATENCY = "extension_latency_ms";

  public static final String MEMORY_OPERATIONS = "memory_operations_total";
  public static final String MEMORY_ERRORS = "memory_errors_total";
  public static final String MEMORY_OPERATION_DURATION = "memory_operation_duration_ms";
  public static final String MEMORY_RECORDS = "memory_records_total";

  public static final String HEALTH_CHECKS = "health_checks_total";
  public static final String HEALTH_CHECK_DURATION = "health_check_duration_ms";
  public static final String HEALTH_STATUS = "health_status";

  /** Prefix of gauges fed by system events. */
  public static final String SYSTEM_PREFIX = "system_";
  public static final String SYSTEM_MEMORY_USAGE = "system_memory_usage_bytes";
  public static final String SYSTEM_CPU_USAGE = "system_cpu_usage_percent";
  public static final String SYSTEM_UPTIME = "system_uptime_seconds";
  public static final String SYSTEM_EVENT_LOOP_LAG = "system_event_loop_lag_ms";

  public static final String OBSERVABILITY_OVERHEAD = "observability_overhead_ms";
  public static final String COLLECTION_DURATION = "metrics_collection_duration_ms";

  private MetricNames() {}
}
