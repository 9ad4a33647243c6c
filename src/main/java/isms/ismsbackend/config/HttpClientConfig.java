package isms.ismsbackend.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class HttpClientConfig {

    // Microsoft Graph (SharePoint) 호출용
    @Bean
    public RestTemplate graphRestTemplate(RestTemplateBuilder builder, IntegrationProperties properties) {
        IntegrationProperties.SharePoint sharePoint = properties.getSharepoint();
        return builder
                .setConnectTimeout(sharePoint.getConnectTimeout())
                .setReadTimeout(sharePoint.getReadTimeout())
                .build();
    }

    // document-service 캐시 무효화 호출용
    @Bean
    public RestTemplate documentServiceRestTemplate(RestTemplateBuilder builder, IntegrationProperties properties) {
        IntegrationProperties.DocumentService documentService = properties.getDocumentService();
        return builder
                .setConnectTimeout(documentService.getConnectTimeout())
                .setReadTimeout(documentService.getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
