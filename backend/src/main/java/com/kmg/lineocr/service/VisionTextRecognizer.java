package com.kmg.lineocr.service;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.gax.rpc.ApiException;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.vision.v1.*;
import com.google.protobuf.ByteString;
import com.kmg.lineocr.model.Fragment;
import com.kmg.lineocr.model.RecognizerCredentials;
import com.kmg.lineocr.model.RecognizerSession;
import jakarta.annotation.PreDestroy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Google Cloud Vision document text detection. Each paragraph becomes one fragment.
 */
@Service
@ConditionalOnProperty(prefix = "ocr.recognizer", name = "provider", havingValue = "vision")
public class VisionTextRecognizer implements TextRecognizer {
    static final String PROVIDER = "vision";

    private final Map<String, ImageAnnotatorClient> clients = new ConcurrentHashMap<>();

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public boolean accepts(RecognizerCredentials credentials) {
        return credentials != null && credentials.keyFile() != null && Files.isRegularFile(credentials.keyFile());
    }

    @Override
    public RecognizerSession authenticate(RecognizerCredentials credentials) {
        if (!accepts(credentials)) {
            throw new AuthenticationFailedException("Vision service-account key file not found");
        }
        String key = credentials.keyFile().toAbsolutePath().normalize().toString();
        try {
            getOrCreateClient(key);
        } catch (IOException e) {
            throw new AuthenticationFailedException("Failed to load Vision credentials: " + e.getMessage(), e);
        }
        return new RecognizerSession(PROVIDER, key);
    }

    @Override
    public List<Fragment> recognize(Path imagePath, RecognizerSession session, String languageHint) {
        try {
            ImageAnnotatorClient client = getOrCreateClient(session.token());
            ByteString content;
            try (InputStream in = Files.newInputStream(imagePath)) {
                content = ByteString.readFrom(in);
            }

            Image image = Image.newBuilder().setContent(content).build();
            Feature feature = Feature.newBuilder().setType(Feature.Type.DOCUMENT_TEXT_DETECTION).build();
            ImageContext.Builder context = ImageContext.newBuilder();
            for (String hint : visionLanguageHints(languageHint)) {
                context.addLanguageHints(hint);
            }

            AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                    .setImage(image)
                    .addFeatures(feature)
                    .setImageContext(context.build())
                    .build();

            BatchAnnotateImagesResponse batchResponse = client.batchAnnotateImages(List.of(request));
            AnnotateImageResponse response = batchResponse.getResponses(0);
            if (response.hasError()) {
                throw new RecognitionFailedException(response.getError().getMessage());
            }
            return extractParagraphs(response.getFullTextAnnotation());
        } catch (ApiException e) {
            throw new RecognitionFailedException(e.getMessage(), e);
        } catch (IOException e) {
            throw new RecognitionFailedException("Failed to read image: " + imagePath, e);
        }
    }

    /**
     * Maps the Baidu-style language codes accepted at the control surface onto Vision hints.
     */
    static List<String> visionLanguageHints(String languageHint) {
        if (languageHint == null || languageHint.isBlank()) {
            return List.of();
        }
        return switch (languageHint.strip().toUpperCase()) {
            case "CHN_ENG" -> List.of("zh", "en");
            case "ENG" -> List.of("en");
            case "JAP" -> List.of("ja");
            case "KOR" -> List.of("ko");
            default -> List.of(languageHint.strip().toLowerCase());
        };
    }

    private ImageAnnotatorClient getOrCreateClient(String keyPath) throws IOException {
        ImageAnnotatorClient existing = clients.get(keyPath);
        if (existing != null) {
            return existing;
        }

        GoogleCredentials credentials;
        try (InputStream in = Files.newInputStream(Path.of(keyPath))) {
            credentials = ServiceAccountCredentials.fromStream(in);
        }
        ImageAnnotatorSettings settings = ImageAnnotatorSettings.newBuilder()
                .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                .build();
        ImageAnnotatorClient created = ImageAnnotatorClient.create(settings);
        ImageAnnotatorClient raced = clients.putIfAbsent(keyPath, created);
        if (raced != null) {
            created.close();
            return raced;
        }
        return created;
    }

    private List<Fragment> extractParagraphs(TextAnnotation annotation) {
        List<Fragment> fragments = new ArrayList<>();
        if (annotation == null) {
            return fragments;
        }

        for (Page page : annotation.getPagesList()) {
            for (Block block : page.getBlocksList()) {
                for (Paragraph paragraph : block.getParagraphsList()) {
                    StringBuilder sb = new StringBuilder();
                    for (Word word : paragraph.getWordsList()) {
                        for (Symbol symbol : word.getSymbolsList()) {
                            sb.append(symbol.getText());
                            TextAnnotation.DetectedBreak.BreakType breakType =
                                    symbol.getProperty().getDetectedBreak().getType();
                            if (breakType == TextAnnotation.DetectedBreak.BreakType.SPACE
                                    || breakType == TextAnnotation.DetectedBreak.BreakType.SURE_SPACE) {
                                sb.append(' ');
                            }
                        }
                    }
                    String text = sb.toString().strip();
                    BoundingPoly poly = paragraph.getBoundingBox();
                    if (text.isEmpty() || poly.getVerticesCount() == 0) {
                        continue;
                    }

                    int minX = Integer.MAX_VALUE;
                    int minY = Integer.MAX_VALUE;
                    int maxX = Integer.MIN_VALUE;
                    int maxY = Integer.MIN_VALUE;
                    for (Vertex vertex : poly.getVerticesList()) {
                        minX = Math.min(minX, vertex.getX());
                        minY = Math.min(minY, vertex.getY());
                        maxX = Math.max(maxX, vertex.getX());
                        maxY = Math.max(maxY, vertex.getY());
                    }

                    Float confidence = paragraph.getConfidence() > 0f ? paragraph.getConfidence() : null;
                    fragments.add(new Fragment(minX, minY, maxX - minX, maxY - minY, text, confidence));
                }
            }
        }
        return fragments;
    }

    @PreDestroy
    void closeClients() {
        clients.values().forEach(ImageAnnotatorClient::close);
        clients.clear();
    }
}
