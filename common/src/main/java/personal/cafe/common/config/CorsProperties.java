package personal.cafe.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * CORS 설정 Properties
 * application.yml의 web.cors.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "web.cors")
public record CorsProperties(
        List<String> allowedOrigins,
        long maxAgeSeconds
) {
    public CorsProperties {
        allowedOrigins = allowedOrigins == null ? List.of("http://localhost:3000") : List.copyOf(allowedOrigins);
        if (maxAgeSeconds <= 0) {
            maxAgeSeconds = 3600;
        }
    }
}
