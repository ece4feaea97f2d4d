package com.appmonitor.collector.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Backed by the JDK client so an interrupted worker abandons its in-flight request.
     */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, HttpClient httpClient, AppMonitorProperties properties) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getReportApi().getRequestTimeout());
        return builder.requestFactory(() -> requestFactory).build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
