package personal.cafe.core.booking.adapter.out.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis Configuration
 * 락 해제용 Lua Script 등록
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisScript<Long> releaseLockScript() {
        return RedisScript.of(new ClassPathResource("scripts/release_lock.lua"), Long.class);
    }
}
