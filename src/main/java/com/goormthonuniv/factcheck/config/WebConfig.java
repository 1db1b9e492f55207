package com.goormthonuniv.factcheck.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig {

    /** 검색 API / LLM 호출 공통 타임아웃 */
    @Bean
    public RestClientCustomizer timeoutCustomizer(FactCheckProperties props) {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(props.getFetchTimeout());
            factory.setReadTimeout(props.getPerSourceTimeout());
            builder.requestFactory(factory);
        };
    }

    @Bean
    public RestClient restClient(RestClient.Builder builder) {
        return builder.build();
    }

    @Bean
    public WebMvcConfigurer corsConfigurer(FactCheckProperties props) {
        String[] origins = props.getCors().getAllowedOrigins().toArray(String[]::new);
        return new WebMvcConfigurer() {
            @Override public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/api/**")
                        .allowedOrigins(origins)
                        .allowedMethods("GET","POST","OPTIONS");
            }
        };
    }
}
