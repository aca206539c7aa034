package com.caltrade.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate calendarRestTemplate(CalendarTradeProperties properties) {
        CalendarTradeProperties.Calendar calendar = properties.getCalendar();
        return build(calendar.getConnectTimeoutMs(), calendar.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate executionRestTemplate(CalendarTradeProperties properties) {
        CalendarTradeProperties.Execution execution = properties.getExecution();
        return build(execution.getConnectTimeoutMs(), execution.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate notificationRestTemplate() {
        return build(5000, 10000);
    }

    private RestTemplate build(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
