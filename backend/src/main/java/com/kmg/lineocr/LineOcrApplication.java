package com.kmg.lineocr;

import com.kmg.lineocr.config.LineOcrProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LineOcrProperties.class)
public class LineOcrApplication {
    public static void main(String[] args) {
        SpringApplication.run(LineOcrApplication.class, args);
    }
}
