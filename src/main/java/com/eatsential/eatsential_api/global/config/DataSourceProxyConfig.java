package com.eatsential.eatsential_api.global.config;

import com.eatsential.eatsential_api.global.logging.SqlMetricsQueryListener;
import javax.sql.DataSource;
import net.ttddyy.dsproxy.support.ProxyDataSourceBuilder;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 모든 DataSource 빈을 datasource-proxy로 감싸 요청 단위 SQL 통계를 수집한다.
 */
@Configuration
@ConditionalOnProperty(prefix = "perf-log", name = "sql-metrics", havingValue = "true", matchIfMissing = true)
public class DataSourceProxyConfig {

	@Bean
	public static BeanPostProcessor dataSourceProxyBeanPostProcessor(SqlMetricsQueryListener listener) {
		return new BeanPostProcessor() {
			@Override
			public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
				if (!(bean instanceof DataSource dataSource)) {
					return bean;
				}
				return ProxyDataSourceBuilder.create(dataSource)
					.name("eatsential-" + beanName)
					.listener(listener)
					.build();
			}
		};
	}
}
