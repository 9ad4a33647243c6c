package isms.ismsbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.TimeZone;

@SpringBootApplication
public class IsmsBackendApplication {

    public static void main(String[] args) {
        // 저장되는 모든 시각은 UTC 기준
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(IsmsBackendApplication.class, args);
    }
}
