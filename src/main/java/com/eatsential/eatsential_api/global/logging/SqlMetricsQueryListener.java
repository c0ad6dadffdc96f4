package com.eatsential.eatsential_api.global.logging;

import java.util.List;
import java.util.stream.Collectors;
import net.ttddyy.dsproxy.ExecutionInfo;
import net.ttddyy.dsproxy.QueryInfo;
import net.ttddyy.dsproxy.listener.QueryExecutionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 실행된 SQL 건수와 시간을 요청 컨텍스트에 누적하고,
 * perf-log.slow-query-ms 이상 걸린 실행은 api.perf.sql 로거에 남긴다.
 */
@Component
public class SqlMetricsQueryListener implements QueryExecutionListener {

	private static final Logger SLOW_SQL_LOG = LoggerFactory.getLogger("api.perf.sql");
	private static final int MAX_QUERY_LENGTH = 300;

	private final long slowQueryMs;

	public SqlMetricsQueryListener(PerfLogProperties properties) {
		this.slowQueryMs = properties.slowQueryMs();
	}

	@Override
	public void beforeQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList) {
		// 실행 후에만 집계
	}

	@Override
	public void afterQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList) {
		int queryCount = (queryInfoList == null) ? 0 : queryInfoList.size();
		long elapsedMs = (execInfo == null) ? 0L : execInfo.getElapsedTime();
		RequestMetricsContext.addQueryMetrics(queryCount, elapsedMs);

		if (isSlow(elapsedMs) && SLOW_SQL_LOG.isWarnEnabled()) {
			SLOW_SQL_LOG.warn("[SlowQuery] elapsedMs={}, success={}, queries={}",
				elapsedMs, execInfo.isSuccess(), abbreviate(queryInfoList));
		}
	}

	boolean isSlow(long elapsedMs) {
		return slowQueryMs > 0 && elapsedMs >= slowQueryMs;
	}

	static String abbreviate(List<QueryInfo> queryInfoList) {
		if (queryInfoList == null || queryInfoList.isEmpty()) {
			return "";
		}
		String joined = queryInfoList.stream()
			.map(QueryInfo::getQuery)
			.map(query -> query == null ? "" : query.replaceAll("\\s+", " ").trim())
			.collect(Collectors.joining("; "));
		return joined.length() <= MAX_QUERY_LENGTH ? joined : joined.substring(0, MAX_QUERY_LENGTH) + "...";
	}
}
