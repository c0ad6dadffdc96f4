package com.eatsential.eatsential_api.global.logging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 느린 요청, 느린 쿼리, 5xx, 추천 생성기 fallback 발생 요청만 api.perf 로거에 JSON 한 줄로 남긴다.
 */
@Component
public class ApiPerfLoggingFilter extends OncePerRequestFilter {

	private static final Logger LOG = LoggerFactory.getLogger("api.perf");

	private final PerfLogProperties perfLogProperties;
	private final ObjectMapper objectMapper;

	public ApiPerfLoggingFilter(
		PerfLogProperties perfLogProperties,
		ObjectMapper objectMapper
	) {
		this.perfLogProperties = perfLogProperties;
		this.objectMapper = objectMapper;
	}

	@Override
	protected boolean shouldNotFilter(HttpServletRequest request) {
		if (!perfLogProperties.enabled()) {
			return true;
		}
		String path = request.getRequestURI();
		return perfLogProperties.excludePathPrefixes().stream()
			.anyMatch(prefix -> prefix != null && !prefix.isBlank() && path.startsWith(prefix));
	}

	@Override
	protected void doFilterInternal(
		HttpServletRequest request,
		HttpServletResponse response,
		FilterChain filterChain
	) throws ServletException, IOException {
		long startNs = System.nanoTime();
		RequestMetricsContext.start();
		Throwable throwable = null;
		try {
			filterChain.doFilter(request, response);
		} catch (Throwable ex) {
			throwable = ex;
			throw ex;
		} finally {
			long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
			RequestMetricsContext.RequestMetrics metrics = RequestMetricsContext.snapshot();
			RequestMetricsContext.clear();

			int status = resolveStatus(response, throwable);
			PerfFlags flags = new PerfFlags(
				elapsedMs >= perfLogProperties.slowRequestMs(),
				metrics.queryTimeMs() >= perfLogProperties.slowQueryMs(),
				status >= HttpStatus.INTERNAL_SERVER_ERROR.value(),
				perfLogProperties.logFallback() && metrics.fallback()
			);

			if (flags.any()) {
				logAsJson(request, status, elapsedMs, metrics, flags);
			}
		}
	}

	private int resolveStatus(HttpServletResponse response, Throwable throwable) {
		if (throwable != null && response.getStatus() < HttpStatus.BAD_REQUEST.value()) {
			return HttpStatus.INTERNAL_SERVER_ERROR.value();
		}
		return response.getStatus();
	}

	private void logAsJson(
		HttpServletRequest request,
		int status,
		long elapsedMs,
		RequestMetricsContext.RequestMetrics metrics,
		PerfFlags flags
	) {
		Map<String, Object> fields = new LinkedHashMap<>();
		fields.put("type", "api_perf");
		fields.put("method", request.getMethod());
		fields.put("path", request.getRequestURI());
		fields.put("status", status);
		fields.put("elapsedMs", elapsedMs);
		fields.put("queryCount", metrics.queryCount());
		fields.put("queryTimeMs", metrics.queryTimeMs());
		if (metrics.generatorSource() != null) {
			fields.put("generator", metrics.generatorSource());
			fields.put("generationMs", metrics.generationMs());
			fields.put("fallback", metrics.fallback());
		}
		fields.put("slowRequest", flags.slowRequest());
		fields.put("slowQuery", flags.slowQuery());
		fields.put("serverError", flags.serverError());

		String traceId = MDC.get("traceId");
		if (traceId != null && !traceId.isBlank()) {
			fields.put("traceId", traceId);
		}

		String requestId = request.getHeader("X-Request-Id");
		if (requestId != null && !requestId.isBlank()) {
			fields.put("requestId", requestId);
		}

		try {
			LOG.info(objectMapper.writeValueAsString(fields));
		} catch (JsonProcessingException ex) {
			LOG.info(
				"type=api_perf method={} path={} status={} elapsedMs={} queryCount={} generator={} fallback={}",
				request.getMethod(),
				request.getRequestURI(),
				status,
				elapsedMs,
				metrics.queryCount(),
				metrics.generatorSource(),
				metrics.fallback()
			);
		}
	}

	private record PerfFlags(boolean slowRequest, boolean slowQuery, boolean serverError, boolean fallback) {

		boolean any() {
			return slowRequest || slowQuery || serverError || fallback;
		}
	}
}
