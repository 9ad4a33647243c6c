package isms.ismsbackend.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer jacksonCustomizer() {
        return builder -> {
            // JSR310 (Java Time) 모듈 등록: LocalDateTime 직렬화/역직렬화 지원
            // Jdk8Module: 부분 수정 요청의 Optional 필드 (누락=null, 명시적 null=Optional.empty())
            builder.modulesToInstall(new JavaTimeModule(), new Jdk8Module());
            // ISO-8601 문자열로 직렬화 (타임스탬프로 하지 않음)
            builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        };
    }
}
