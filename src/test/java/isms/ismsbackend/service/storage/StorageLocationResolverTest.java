package isms.ismsbackend.service.storage;

import isms.ismsbackend.config.IntegrationProperties;
import isms.ismsbackend.enums.StorageLocation;
import isms.ismsbackend.support.DocumentFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("문서 URL 계산")
class StorageLocationResolverTest {

    private static final String ITEM_URL = "https://graph.test/v1.0/sites/site-1/drives/drive-1/items/item-1";
    private static final String SITE_URL = "https://graph.test/v1.0/sites/site-1";

    private MockRestServiceServer server;
    private IntegrationProperties properties;
    private StorageLocationResolver resolver;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = DocumentFixtures.properties();
        resolver = new StorageLocationResolver(
                new SharePointGraphClient(restTemplate, properties),
                new ConfluenceUrlBuilder(properties));
    }

    private static StorageIdentifiers sharePointIds() {
        return StorageIdentifiers.sharePoint("site-1", "drive-1", "item-1");
    }

    @Nested
    @DisplayName("SharePoint 위치")
    class SharePoint {

        @Test
        @DisplayName("Graph 항목의 webUrl 반환")
        void returnsItemWebUrl() {
            server.expect(requestTo(ITEM_URL))
                    .andExpect(method(HttpMethod.GET))
                    .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer graph-token"))
                    .andRespond(withSuccess("{\"id\":\"item-1\",\"name\":\"Policy.docx\","
                            + "\"webUrl\":\"https://tenant.sharepoint.com/sites/isms/Policy.docx\"}", MediaType.APPLICATION_JSON));

            Optional<String> url = resolver.resolve(StorageLocation.SHAREPOINT, sharePointIds(), "graph-token");

            assertThat(url).contains("https://tenant.sharepoint.com/sites/isms/Policy.docx");
            server.verify();
        }

        @Test
        @DisplayName("항목에 webUrl이 없으면 사이트 뷰어 링크로 대체")
        void fallsBackToSiteViewer() {
            server.expect(requestTo(ITEM_URL))
                    .andRespond(withSuccess("{\"id\":\"item-1\",\"name\":\"Policy.docx\"}", MediaType.APPLICATION_JSON));
            server.expect(requestTo(SITE_URL))
                    .andRespond(withSuccess("{\"webUrl\":\"https://tenant.sharepoint.com/sites/isms\"}", MediaType.APPLICATION_JSON));

            Optional<String> url = resolver.resolve(StorageLocation.SHAREPOINT, sharePointIds(), "graph-token");

            assertThat(url).contains("https://tenant.sharepoint.com/sites/isms/_layouts/15/Doc.aspx?sourcedoc=item-1");
            server.verify();
        }

        @Test
        @DisplayName("삭제되었거나 없는 항목은 사이트 링크를 만들지 않고 empty")
        void missingItemResolvesToEmpty() {
            server.expect(requestTo("https://graph.test/v1.0/sites/site-1/drives/drive-1/items/deleted-item"))
                    .andRespond(withStatus(HttpStatus.NOT_FOUND));

            Optional<String> url = resolver.resolve(StorageLocation.SHAREPOINT,
                    StorageIdentifiers.sharePoint("site-1", "drive-1", "deleted-item"), "graph-token");

            assertThat(url).isEmpty();
            // 사이트 조회 요청이 나가지 않아야 한다
            server.verify();
        }

        @Test
        @DisplayName("원격 실패는 예외 대신 empty")
        void upstreamFailureIsAbsorbed() {
            server.expect(requestTo(ITEM_URL)).andRespond(withServerError());

            assertThat(resolver.resolve(StorageLocation.SHAREPOINT, sharePointIds(), "graph-token")).isEmpty();
        }

        @Test
        @DisplayName("토큰이 없으면 호출하지 않는다")
        void noTokenNoCall() {
            assertThat(resolver.resolve(StorageLocation.SHAREPOINT, sharePointIds(), null)).isEmpty();
            assertThat(resolver.resolve(StorageLocation.SHAREPOINT, sharePointIds(), "")).isEmpty();
            server.verify();
        }

        @Test
        @DisplayName("식별자가 모자라면 empty")
        void incompleteIdentifiers() {
            StorageIdentifiers ids = StorageIdentifiers.sharePoint("site-1", "drive-1", "");

            assertThat(resolver.identifiersComplete(StorageLocation.SHAREPOINT, ids)).isFalse();
            assertThat(resolver.resolve(StorageLocation.SHAREPOINT, ids, "graph-token")).isEmpty();
            server.verify();
        }
    }

    @Nested
    @DisplayName("Confluence 위치")
    class Confluence {

        @Test
        @DisplayName("끝 슬래시를 제거하고 viewpage URL 생성")
        void buildsViewPageUrl() {
            Optional<String> url = resolver.resolve(StorageLocation.CONFLUENCE,
                    StorageIdentifiers.confluence("ISMS", "4242"), null);

            assertThat(url).contains("https://wiki.example.com/pages/viewpage.action?pageId=4242");
        }

        @Test
        @DisplayName("base URL이 없으면 empty")
        void missingBaseUrl() {
            properties.getConfluence().setBaseUrl(null);

            assertThat(resolver.resolve(StorageLocation.CONFLUENCE,
                    StorageIdentifiers.confluence("ISMS", "4242"), null)).isEmpty();
        }

        @Test
        @DisplayName("SharePoint 식별자로는 Confluence 위치를 완성하지 않는다")
        void wrongProviderIdentifiers() {
            assertThat(resolver.identifiersComplete(StorageLocation.CONFLUENCE, sharePointIds())).isFalse();
        }
    }
}
