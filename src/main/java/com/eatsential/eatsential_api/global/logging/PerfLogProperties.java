package com.eatsential.eatsential_api.global.logging;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "perf-log")
public record PerfLogProperties(
	Boolean enabled,
	Long slowRequestMs,
	Long slowQueryMs,
	Boolean logFallback,
	List<String> excludePathPrefixes
) {

	public PerfLogProperties {
		if (enabled == null) {
			enabled = Boolean.TRUE;
		}
		if (slowRequestMs == null) {
			slowRequestMs = 500L;
		}
		if (slowQueryMs == null) {
			slowQueryMs = 200L;
		}
		if (logFallback == null) {
			logFallback = Boolean.TRUE;
		}
		if (excludePathPrefixes == null) {
			excludePathPrefixes = List.of("/actuator", "/swagger-ui", "/v3/api-docs");
		}
	}
}
