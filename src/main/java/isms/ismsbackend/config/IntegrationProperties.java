package isms.ismsbackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 외부 연동 및 레지스트리 동작 설정 (application.yml의 integration.*)
 */
@Setter
@Getter
@Configuration
@ConfigurationProperties(prefix = "integration")
public class IntegrationProperties {

    private SharePoint sharepoint = new SharePoint();
    private Confluence confluence = new Confluence();
    private DocumentService documentService = new DocumentService();
    private Registry registry = new Registry();

    @Setter
    @Getter
    public static class SharePoint {
        private String graphBaseUrl = "https://graph.microsoft.com/v1.0";
        // 일괄 가져오기에서 항목별 siteId/driveId가 없을 때 사용
        private String defaultSiteId;
        private String defaultDriveId;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Setter
    @Getter
    public static class Confluence {
        // 미설정 시 Confluence URL은 생성하지 않는다
        private String baseUrl;
    }

    /**
     * PDF 변환/캐시를 담당하는 document-service
     */
    @Setter
    @Getter
    public static class DocumentService {
        private String baseUrl;
        private String internalToken;
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Setter
    @Getter
    public static class Registry {
        private int hardDeleteTimeoutSeconds = 30;
        private int upcomingReviewWindowDays = 30;
    }
}
