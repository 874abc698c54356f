package com.kmg.lineocr.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.lineocr.config.LineOcrProperties;
import com.kmg.lineocr.model.Fragment;
import com.kmg.lineocr.model.RecognizerCredentials;
import com.kmg.lineocr.model.RecognizerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

@Service
@ConditionalOnProperty(prefix = "ocr.recognizer", name = "provider", havingValue = "baidu", matchIfMissing = true)
public class BaiduTextRecognizer implements TextRecognizer {
    private static final Logger log = LoggerFactory.getLogger(BaiduTextRecognizer.class);
    static final String PROVIDER = "baidu";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final LineOcrProperties.Baidu settings;

    public BaiduTextRecognizer(
            @Qualifier("ocrRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            LineOcrProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = properties.getRecognizer().getBaidu();
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public boolean accepts(RecognizerCredentials credentials) {
        return credentials != null && credentials.hasKeyPair();
    }

    @Override
    public RecognizerSession authenticate(RecognizerCredentials credentials) {
        if (!accepts(credentials)) {
            throw new AuthenticationFailedException("Missing api key / secret key");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(settings.getTokenUrl())
                .queryParam("grant_type", "client_credentials")
                .queryParam("client_id", credentials.apiKey())
                .queryParam("client_secret", credentials.secretKey())
                .encode()
                .build()
                .toUri();

        JsonNode payload;
        try {
            payload = restTemplate.getForObject(uri, JsonNode.class);
        } catch (HttpStatusCodeException e) {
            JsonNode body = readBody(e.getResponseBodyAsString());
            String error = firstText(body, "error_description", "error");
            throw new AuthenticationFailedException(
                    "Failed to get access token: status=" + e.getStatusCode().value() + ", error=" + (error == null ? "http_error" : error), e);
        } catch (RestClientException e) {
            throw new AuthenticationFailedException("Network error while requesting access token: " + e.getClass().getSimpleName(), e);
        }

        String token = payload == null ? null : firstText(payload, "access_token");
        if (token == null || token.isBlank()) {
            String error = payload == null ? null : firstText(payload, "error_description", "error");
            throw new AuthenticationFailedException("Failed to get access token: " + (error == null ? "empty response" : error));
        }
        return new RecognizerSession(PROVIDER, token);
    }

    @Override
    public List<Fragment> recognize(Path image, RecognizerSession session, String languageHint) {
        String imageName = image.getFileName().toString();
        String encoded;
        try {
            encoded = Base64.getEncoder().encodeToString(Files.readAllBytes(image));
        } catch (IOException e) {
            throw new RecognitionFailedException("Failed to read image: " + imageName, e);
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("image", encoded);
        form.add("language_type", languageHint);
        form.add("detect_direction", "true");
        form.add("multidirectional_recognize", "true");
        form.add("probability", "true");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        URI uri = UriComponentsBuilder.fromHttpUrl(settings.getOcrUrl())
                .queryParam("access_token", session.token())
                .encode()
                .build()
                .toUri();

        JsonNode payload;
        try {
            payload = restTemplate.postForObject(uri, new HttpEntity<>(form, headers), JsonNode.class);
        } catch (HttpStatusCodeException e) {
            JsonNode body = readBody(e.getResponseBodyAsString());
            String error = firstText(body, "error_msg", "error_code");
            throw new RecognitionFailedException("OCR request failed for " + imageName + ": status="
                    + e.getStatusCode().value() + ", error=" + (error == null ? "http_error" : error), e);
        } catch (RestClientException e) {
            throw new RecognitionFailedException("Network error while OCR request for " + imageName + ": "
                    + e.getClass().getSimpleName(), e);
        }

        if (payload == null) {
            throw new RecognitionFailedException("Empty OCR response for " + imageName);
        }
        if (payload.has("error_code")) {
            throw new RecognitionFailedException("OCR failed for " + imageName + ": "
                    + payload.path("error_code").asText() + " " + payload.path("error_msg").asText(""));
        }
        return toFragments(payload.path("words_result"));
    }

    static List<Fragment> toFragments(JsonNode wordsResult) {
        List<Fragment> fragments = new ArrayList<>();
        if (wordsResult == null || !wordsResult.isArray()) {
            return fragments;
        }
        for (JsonNode item : wordsResult) {
            if (!item.isObject()) {
                continue;
            }
            JsonNode location = item.path("location");
            JsonNode average = item.path("probability").path("average");
            Float confidence = average.isNumber() ? (float) average.asDouble() : null;
            fragments.add(new Fragment(
                    location.path("left").asInt(0),
                    location.path("top").asInt(0),
                    location.path("width").asInt(0),
                    location.path("height").asInt(0),
                    item.path("words").asText(""),
                    confidence
            ));
        }
        return fragments;
    }

    private JsonNode readBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
            return null;
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
