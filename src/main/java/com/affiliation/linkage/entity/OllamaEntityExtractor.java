package com.affiliation.linkage.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entity extractor backed by a local Ollama model.
 *
 * Ollama must be running locally (default: http://localhost:11434).
 *
 * Usage:
 * <pre>
 * EntityExtractor extractor = OllamaEntityExtractor.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 *
 * <p>The model is asked to answer one organization per line as {@code name | score}.
 * Lines that do not follow the format are ignored.</p>
 */
public class OllamaEntityExtractor implements EntityExtractor {
    private static final Logger log = LoggerFactory.getLogger(OllamaEntityExtractor.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final double DEFAULT_SCORE = 0.5;

    private static final Pattern LINE_PATTERN = Pattern.compile(
            "^\\s*(?:[-*]|\\d+[.)])?\\s*(.+?)\\s*(?:\\|\\s*([0-9]*\\.?[0-9]+))?\\s*$");

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaEntityExtractor(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<OrganizationCandidate> extractOrganizations(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        try {
            String response = callOllama(buildPrompt(text));
            List<OrganizationCandidate> candidates = parseResponse(response);
            log.debug("entity.extracted text='{}' candidates={}", text, candidates.size());
            return candidates;
        } catch (IOException e) {
            log.warn("entity.extractionFailed model={} error={}", model, e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("entity.extractionInterrupted model={}", model);
            return List.of();
        }
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("entity.ollamaUnavailable error={}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String buildPrompt(String text) {
        return "List every organization (university, institute, company, hospital, agency) named in the "
                + "affiliation text below.\n"
                + "Answer with one organization per line in the format: NAME | CONFIDENCE\n"
                + "CONFIDENCE is a number from 0.0 to 1.0. Answer NONE if there is no organization.\n\n"
                + "Text: \"" + text + "\"\n";
    }

    private String callOllama(String prompt) throws IOException, InterruptedException {
        OllamaRequest ollamaRequest = new OllamaRequest(model, prompt, false);
        String requestBody = objectMapper.writeValueAsString(ollamaRequest);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("Ollama returned status " + response.statusCode() + ": " + response.body());
        }
        OllamaResponse ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
        return ollamaResponse.response() != null ? ollamaResponse.response() : "";
    }

    /**
     * Parses {@code name | score} lines. A missing score defaults to 0.5; scores given as
     * percentages are scaled down.
     */
    static List<OrganizationCandidate> parseResponse(String response) {
        List<OrganizationCandidate> candidates = new ArrayList<>();
        for (String line : response.split("\\R")) {
            if (line.isBlank() || line.trim().equalsIgnoreCase("NONE")) {
                continue;
            }
            Matcher matcher = LINE_PATTERN.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            String name = matcher.group(1).replaceAll("^[\"']|[\"']$", "").trim();
            if (name.isEmpty() || name.endsWith(":")) {
                continue;
            }
            double score = DEFAULT_SCORE;
            if (matcher.group(2) != null) {
                score = Double.parseDouble(matcher.group(2));
                if (score > 1.0 && score <= 100.0) {
                    score = score / 100.0;
                }
                score = Math.min(1.0, Math.max(0.0, score));
            }
            candidates.add(new OrganizationCandidate(name, score));
        }
        return candidates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public OllamaEntityExtractor build() {
            return new OllamaEntityExtractor(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaRequest(
            String model,
            String prompt,
            boolean stream
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
