package io.osquerymcp.core.args;

/**
 * GetQueryInsightsTool takes no parameters beyond the cluster target.
 */
public record QueryInsightsParams() {}
