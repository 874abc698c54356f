package com.kmg.lineocr.service;

import com.kmg.lineocr.config.LineOcrProperties;
import com.kmg.lineocr.model.RecognizerCredentials;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Resolves recognizer credentials: keys in the request win, then the configured credentials file, then the
 * {@code BAIDU_OCR_API_KEY} / {@code BAIDU_OCR_SECRET_KEY} environment variables.
 */
@Service
public class CredentialResolver {
    static final String API_KEY_ENV = "BAIDU_OCR_API_KEY";
    static final String SECRET_KEY_ENV = "BAIDU_OCR_SECRET_KEY";

    private static final Set<String> API_KEY_NAMES = Set.of("api_key", "apikey", "client_id", "ak", "access_key", "accesskey");
    private static final Set<String> SECRET_KEY_NAMES = Set.of("secret_key", "secretkey", "client_secret", "sk", "secret", "secretaccesskey");

    private final LineOcrProperties properties;
    private final Environment environment;
    private final TextRecognizer recognizer;

    public CredentialResolver(LineOcrProperties properties, Environment environment, TextRecognizer recognizer) {
        this.properties = properties;
        this.environment = environment;
        this.recognizer = recognizer;
    }

    /**
     * @throws InvalidJobInputException when the active recognizer cannot work with what was found
     */
    public RecognizerCredentials resolve(String requestApiKey, String requestSecretKey) {
        String apiKey = clean(requestApiKey);
        String secretKey = clean(requestSecretKey);

        String credentialsFile = properties.getRecognizer().getCredentialsFile();
        if ((apiKey.isEmpty() || secretKey.isEmpty()) && credentialsFile != null && !credentialsFile.isBlank()) {
            KeyPair fromFile = parseCredentialsFile(Path.of(credentialsFile));
            if (apiKey.isEmpty()) {
                apiKey = fromFile.apiKey();
            }
            if (secretKey.isEmpty()) {
                secretKey = fromFile.secretKey();
            }
        }
        if (apiKey.isEmpty()) {
            apiKey = clean(environment.getProperty(API_KEY_ENV));
        }
        if (secretKey.isEmpty()) {
            secretKey = clean(environment.getProperty(SECRET_KEY_ENV));
        }

        String visionKey = properties.getRecognizer().getVision().getCredentialsFile();
        Path keyFile = visionKey == null || visionKey.isBlank() ? null : Path.of(visionKey);

        RecognizerCredentials credentials = new RecognizerCredentials(apiKey, secretKey, keyFile);
        if (!recognizer.accepts(credentials)) {
            throw new InvalidJobInputException("Missing credentials for the " + recognizer.provider() + " recognizer");
        }
        return credentials;
    }

    /**
     * Reads {@code KEY=VALUE} / {@code KEY: VALUE} lines, or a plain two-line file holding the api key and
     * then the secret key. Blank lines and {@code #} comments are ignored.
     */
    static KeyPair parseCredentialsFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidJobInputException("Credentials file not found: " + file);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .map(line -> line.replace("\uFEFF", "").strip())
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .toList();
        } catch (IOException e) {
            throw new InvalidJobInputException("Failed to read credentials file: " + file, e);
        }

        String apiKey = "";
        String secretKey = "";
        for (String line : lines) {
            int sep = separatorIndex(line);
            if (sep < 0) {
                continue;
            }
            String name = line.substring(0, sep).strip().toLowerCase().replace('-', '_').replace(' ', '_');
            String value = clean(line.substring(sep + 1));
            if (value.isEmpty()) {
                continue;
            }
            if (API_KEY_NAMES.contains(name)) {
                apiKey = value;
            } else if (SECRET_KEY_NAMES.contains(name)) {
                secretKey = value;
            }
        }

        if (apiKey.isEmpty() && !lines.isEmpty() && separatorIndex(lines.get(0)) < 0) {
            apiKey = lines.get(0);
        }
        if (secretKey.isEmpty() && lines.size() >= 2 && separatorIndex(lines.get(1)) < 0) {
            secretKey = lines.get(1);
        }
        return new KeyPair(apiKey, secretKey);
    }

    private static int separatorIndex(String line) {
        int eq = line.indexOf('=');
        return eq >= 0 ? eq : line.indexOf(':');
    }

    static String clean(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = value.strip();
        if (cleaned.length() >= 2) {
            char first = cleaned.charAt(0);
            char last = cleaned.charAt(cleaned.length() - 1);
            if (first == last && (first == '\'' || first == '"')) {
                cleaned = cleaned.substring(1, cleaned.length() - 1).strip();
            }
        }
        return cleaned;
    }

    record KeyPair(String apiKey, String secretKey) {
        @Override
        public String toString() {
            return "KeyPair[***]";
        }
    }
}
