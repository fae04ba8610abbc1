package tw.gc.auto.control;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;
import tw.gc.auto.control.config.ControlPlaneProperties;

import java.time.Clock;

@Configuration
@Slf4j
public class AppConfig {

    @Bean
    public RestTemplate restTemplate(ControlPlaneProperties properties) {
        ControlPlaneProperties.Evolution evolution = properties.getEvolution();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(evolution.getConnectTimeoutMs());
        factory.setReadTimeout(evolution.getReadTimeoutMs());
        return new RestTemplate(factory);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Promotion sweep, safety timers, risk monitor and nudge breaker sweep run independently.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("control-sched-");
        scheduler.setErrorHandler(t -> log.error("❌ Scheduled task failed", t));
        return scheduler;
    }
}
