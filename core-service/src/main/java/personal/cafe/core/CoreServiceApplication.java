package personal.cafe.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Core Service Application
 * User, Booking 도메인을 포함하는 카페 예약 서비스
 */
@ConfigurationPropertiesScan
@EnableScheduling  // 지난 예약 마감 스케줄러
@SpringBootApplication(
    scanBasePackages = {
        "personal.cafe.core",
        "personal.cafe.common"  // common 모듈의 GlobalExceptionHandler, CorsConfig 스캔
    }
)
public class CoreServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CoreServiceApplication.class, args);
    }
}
