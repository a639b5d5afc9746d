package com.radiochat.config;

import java.time.Clock;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 공용 Bean 정의를 담고 있는 설정 클래스.
 */
@Configuration
public class AppConfig {

	/**
	 * 외부 블롭 스토어 업로드에 사용할 RestTemplate을 생성한다.
	 */
	@Bean
	public RestTemplate restTemplate() {
		RequestConfig rc = RequestConfig.custom()
			.setConnectTimeout(Timeout.ofSeconds(3))
			.setResponseTimeout(Timeout.ofSeconds(10))
			.setExpectContinueEnabled(false)
			.build();

		CloseableHttpClient httpClient = HttpClients.custom()
			// 업로드 경로에는 고유 ID가 들어가므로 재시도는 호출자가 결정한다.
			.setDefaultRequestConfig(rc)
			.disableAutomaticRetries()
			.build();

		var rf = new HttpComponentsClientHttpRequestFactory(httpClient);
		return new RestTemplate(rf);
	}

	/**
	 * 메시지 타임스탬프와 토큰 획득 시각에 사용하는 시계.
	 */
	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

}
