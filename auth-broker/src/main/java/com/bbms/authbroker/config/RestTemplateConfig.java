package com.bbms.authbroker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate providerRestTemplate(ProviderProperties providerProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) providerProperties.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) providerProperties.getReadTimeout().toMillis());
        return new RestTemplate(factory);
    }
}
