package com.eatsential.eatsential_api.global.logging;

/**
 * 요청 스레드 단위로 SQL 실행 통계와 추천 생성기 결과(source/fallback)를 모은다.
 * ApiPerfLoggingFilter가 start/clear 수명을 관리한다.
 */
public final class RequestMetricsContext {

	private static final ThreadLocal<MetricsAccumulator> HOLDER = new ThreadLocal<>();

	private RequestMetricsContext() {
	}

	public static void start() {
		HOLDER.set(new MetricsAccumulator());
	}

	public static void addQueryMetrics(int queryCount, long elapsedMs) {
		MetricsAccumulator accumulator = HOLDER.get();
		if (accumulator == null) {
			return;
		}
		accumulator.queryCount += Math.max(queryCount, 0);
		accumulator.queryTimeMs += Math.max(elapsedMs, 0L);
	}

	public static void recordGeneration(String source, boolean fallback, long generationMs) {
		MetricsAccumulator accumulator = HOLDER.get();
		if (accumulator == null) {
			return;
		}
		accumulator.generatorSource = source;
		accumulator.fallback = fallback;
		accumulator.generationMs = Math.max(generationMs, 0L);
	}

	public static RequestMetrics snapshot() {
		MetricsAccumulator accumulator = HOLDER.get();
		if (accumulator == null) {
			return new RequestMetrics(0, 0L, null, false, 0L);
		}
		return new RequestMetrics(
			accumulator.queryCount,
			accumulator.queryTimeMs,
			accumulator.generatorSource,
			accumulator.fallback,
			accumulator.generationMs
		);
	}

	public static void clear() {
		HOLDER.remove();
	}

	public record RequestMetrics(
		int queryCount,
		long queryTimeMs,
		String generatorSource,
		boolean fallback,
		long generationMs
	) {
	}

	private static final class MetricsAccumulator {
		private int queryCount;
		private long queryTimeMs;
		private String generatorSource;
		private boolean fallback;
		private long generationMs;
	}
}
