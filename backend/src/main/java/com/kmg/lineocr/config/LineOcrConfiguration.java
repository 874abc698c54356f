package com.kmg.lineocr.config;

import com.kmg.lineocr.layout.LayoutThresholds;
import com.kmg.lineocr.service.RunSettings;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class LineOcrConfiguration {

    @Bean
    public LayoutThresholds layoutThresholds(LineOcrProperties properties) {
        return properties.getLayout().toThresholds();
    }

    @Bean
    public RunSettings runSettings(LineOcrProperties properties) {
        return new RunSettings(
                Path.of(properties.getOutput().getRunsDir()),
                properties.getOutput().getFlushEveryPages(),
                properties.getRecognizer().getPageInterval()
        );
    }

    /**
     * One worker thread per job; jobs are not queued behind each other.
     */
    @Bean(name = "jobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("ocr-job-"));
    }

    @Bean(name = "ocrRestTemplate")
    public RestTemplate ocrRestTemplate(RestTemplateBuilder builder, LineOcrProperties properties) {
        Duration timeout = properties.getRecognizer().getTimeout();
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
