package com.kmg.lineocr.config;

import com.kmg.lineocr.layout.LayoutThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "ocr")
public class LineOcrProperties {
    @NotBlank
    private String baseDir;
    @Valid
    @NotNull
    private Browser browser = new Browser();
    @Valid
    @NotNull
    private Output output = new Output();
    @Valid
    @NotNull
    private State state = new State();
    @Valid
    @NotNull
    private Logs logs = new Logs();
    @Valid
    @NotNull
    private Render render = new Render();
    @Valid
    @NotNull
    private Recognizer recognizer = new Recognizer();
    @Valid
    @NotNull
    private Layout layout = new Layout();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Browser getBrowser() {
        return browser;
    }

    public void setBrowser(Browser browser) {
        this.browser = browser;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Recognizer getRecognizer() {
        return recognizer;
    }

    public void setRecognizer(Recognizer recognizer) {
        this.recognizer = recognizer;
    }

    public Layout getLayout() {
        return layout;
    }

    public void setLayout(Layout layout) {
        this.layout = layout;
    }

    public Path baseDirPath() {
        return Path.of(baseDir);
    }

    public static class Browser {
        private boolean autoOpen = false;

        public boolean isAutoOpen() {
            return autoOpen;
        }

        public void setAutoOpen(boolean autoOpen) {
            this.autoOpen = autoOpen;
        }
    }

    public static class Output {
        @NotBlank
        private String runsDir;
        @NotBlank
        private String reportDir;
        @Min(1)
        private int flushEveryPages = 10;

        public String getRunsDir() {
            return runsDir;
        }

        public void setRunsDir(String runsDir) {
            this.runsDir = runsDir;
        }

        public String getReportDir() {
            return reportDir;
        }

        public void setReportDir(String reportDir) {
            this.reportDir = reportDir;
        }

        public int getFlushEveryPages() {
            return flushEveryPages;
        }

        public void setFlushEveryPages(int flushEveryPages) {
            this.flushEveryPages = flushEveryPages;
        }
    }

    public static class State {
        @NotBlank
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Render {
        @Min(1)
        private int minDpi = 72;
        @Max(2400)
        private int maxDpi = 600;
        private int defaultDpi = 300;

        public int getMinDpi() {
            return minDpi;
        }

        public void setMinDpi(int minDpi) {
            this.minDpi = minDpi;
        }

        public int getMaxDpi() {
            return maxDpi;
        }

        public void setMaxDpi(int maxDpi) {
            this.maxDpi = maxDpi;
        }

        public int getDefaultDpi() {
            return defaultDpi;
        }

        public void setDefaultDpi(int defaultDpi) {
            this.defaultDpi = defaultDpi;
        }
    }

    public static class Recognizer {
        @NotBlank
        private String provider = "baidu";
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);
        @NotNull
        private Duration pageInterval = Duration.ZERO;
        @NotBlank
        private String defaultLanguage = "CHN_ENG";
        private String credentialsFile;
        @Valid
        @NotNull
        private Baidu baidu = new Baidu();
        @Valid
        @NotNull
        private Vision vision = new Vision();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getPageInterval() {
            return pageInterval;
        }

        public void setPageInterval(Duration pageInterval) {
            this.pageInterval = pageInterval;
        }

        public String getDefaultLanguage() {
            return defaultLanguage;
        }

        public void setDefaultLanguage(String defaultLanguage) {
            this.defaultLanguage = defaultLanguage;
        }

        public String getCredentialsFile() {
            return credentialsFile;
        }

        public void setCredentialsFile(String credentialsFile) {
            this.credentialsFile = credentialsFile;
        }

        public Baidu getBaidu() {
            return baidu;
        }

        public void setBaidu(Baidu baidu) {
            this.baidu = baidu;
        }

        public Vision getVision() {
            return vision;
        }

        public void setVision(Vision vision) {
            this.vision = vision;
        }
    }

    public static class Baidu {
        @NotBlank
        private String tokenUrl = "https://aip.baidubce.com/oauth/2.0/token";
        @NotBlank
        private String ocrUrl = "https://aip.baidubce.com/rest/2.0/ocr/v1/accurate";

        public String getTokenUrl() {
            return tokenUrl;
        }

        public void setTokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
        }

        public String getOcrUrl() {
            return ocrUrl;
        }

        public void setOcrUrl(String ocrUrl) {
            this.ocrUrl = ocrUrl;
        }
    }

    public static class Vision {
        private String credentialsFile;

        public String getCredentialsFile() {
            return credentialsFile;
        }

        public void setCredentialsFile(String credentialsFile) {
            this.credentialsFile = credentialsFile;
        }
    }

    public static class Layout {
        private double rowBucketFactor = 0.8;
        private double rowBucketMin = 8;
        private double columnBucketFactor = 1.2;
        private double columnBucketMin = 12;
        private double fallbackSize = 20;
        private double verticalAspect = 1.15;
        private double verticalRatio = 0.6;
        private double bandFactor = 1.8;
        private double bandMin = 20;
        private double bandFallback = 40;
        @Min(1)
        private int minBands = 2;
        @Min(0)
        private int minFragments = 2;

        public LayoutThresholds toThresholds() {
            return new LayoutThresholds(
                    rowBucketFactor,
                    rowBucketMin,
                    columnBucketFactor,
                    columnBucketMin,
                    fallbackSize,
                    verticalAspect,
                    verticalRatio,
                    bandFactor,
                    bandMin,
                    bandFallback,
                    minBands,
                    minFragments
            );
        }

        public double getRowBucketFactor() {
            return rowBucketFactor;
        }

        public void setRowBucketFactor(double rowBucketFactor) {
            this.rowBucketFactor = rowBucketFactor;
        }

        public double getRowBucketMin() {
            return rowBucketMin;
        }

        public void setRowBucketMin(double rowBucketMin) {
            this.rowBucketMin = rowBucketMin;
        }

        public double getColumnBucketFactor() {
            return columnBucketFactor;
        }

        public void setColumnBucketFactor(double columnBucketFactor) {
            this.columnBucketFactor = columnBucketFactor;
        }

        public double getColumnBucketMin() {
            return columnBucketMin;
        }

        public void setColumnBucketMin(double columnBucketMin) {
            this.columnBucketMin = columnBucketMin;
        }

        public double getFallbackSize() {
            return fallbackSize;
        }

        public void setFallbackSize(double fallbackSize) {
            this.fallbackSize = fallbackSize;
        }

        public double getVerticalAspect() {
            return verticalAspect;
        }

        public void setVerticalAspect(double verticalAspect) {
            this.verticalAspect = verticalAspect;
        }

        public double getVerticalRatio() {
            return verticalRatio;
        }

        public void setVerticalRatio(double verticalRatio) {
            this.verticalRatio = verticalRatio;
        }

        public double getBandFactor() {
            return bandFactor;
        }

        public void setBandFactor(double bandFactor) {
            this.bandFactor = bandFactor;
        }

        public double getBandMin() {
            return bandMin;
        }

        public void setBandMin(double bandMin) {
            this.bandMin = bandMin;
        }

        public double getBandFallback() {
            return bandFallback;
        }

        public void setBandFallback(double bandFallback) {
            this.bandFallback = bandFallback;
        }

        public int getMinBands() {
            return minBands;
        }

        public void setMinBands(int minBands) {
            this.minBands = minBands;
        }

        public int getMinFragments() {
            return minFragments;
        }

        public void setMinFragments(int minFragments) {
            this.minFragments = minFragments;
        }
    }
}
