package com.kmg.lineocr.service;

import com.kmg.lineocr.config.LineOcrProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.*;
import java.io.IOException;
import java.net.URI;

/**
 * Opens the local job API in a browser on start when {@code ocr.browser.auto-open} is set.
 */
@Service
public class BrowserLauncher {
    private static final Logger log = LoggerFactory.getLogger(BrowserLauncher.class);

    private final LineOcrProperties properties;

    public BrowserLauncher(LineOcrProperties properties) {
        this.properties = properties;
    }

    public boolean openIfEnabled(int port) {
        if (!properties.getBrowser().isAutoOpen()) {
            return false;
        }
        if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()) {
            log.info("No desktop available; browser auto-open skipped.");
            return false;
        }

        try {
            Desktop.getDesktop().browse(URI.create("http://localhost:" + port + "/api/jobs"));
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Failed to open browser automatically: {}", e.getMessage());
            return false;
        }
    }
}
