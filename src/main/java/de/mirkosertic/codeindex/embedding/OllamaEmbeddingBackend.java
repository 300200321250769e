package de.mirkosertic.codeindex.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embedding backend talking to an Ollama server ({@code POST /api/embed}).
 * <p>
 * I/O errors, 408, 429 and 5xx responses are transient. Other client errors, malformed
 * responses and vectors of the wrong dimension are fatal.
 */
public class OllamaEmbeddingBackend implements EmbeddingBackend {

    private static final Logger logger = LoggerFactory.getLogger(OllamaEmbeddingBackend.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final int dimension;

    public OllamaEmbeddingBackend(final OkHttpClient httpClient, final String baseUrl, final String model,
                                  final int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = baseUrl.endsWith("/") ? baseUrl + "api/embed" : baseUrl + "/api/embed";
        this.model = model;
        this.dimension = dimension;
    }

    public static OkHttpClient defaultClient(final Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .build();
    }

    @Override
    public float[] embed(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(final List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        final Request request = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(payload(texts), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            final ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                final int code = response.code();
                final String message = "Embedding request failed with HTTP " + code + " from " + endpoint;
                if (code == 408 || code == 429 || code >= 500) {
                    throw new EmbeddingException(message, true);
                }
                throw EmbeddingException.fatal(message + (body != null ? ": " + body.string() : ""));
            }
            if (body == null) {
                throw EmbeddingException.fatal("Empty embedding response from " + endpoint);
            }
            return parse(body.string(), texts.size());
        } catch (final JsonProcessingException e) {
            throw new EmbeddingException("Malformed embedding response from " + endpoint, e, false);
        } catch (final IOException e) {
            logger.debug("Embedding call to {} failed: {}", endpoint, e.getMessage());
            throw EmbeddingException.transientFailure("Embedding call to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    private String payload(final List<String> texts) {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", texts);
        try {
            return mapper.writeValueAsString(payload);
        } catch (final JsonProcessingException e) {
            throw new EmbeddingException("Cannot serialize embedding request", e, false);
        }
    }

    private List<float[]> parse(final String json, final int expected) throws JsonProcessingException {
        final JsonNode embeddings = mapper.readTree(json).path("embeddings");
        if (!embeddings.isArray() || embeddings.size() != expected) {
            throw EmbeddingException.fatal("Malformed embedding response: expected " + expected + " vectors");
        }
        final List<float[]> vectors = new ArrayList<>(expected);
        for (final JsonNode vectorNode : embeddings) {
            if (vectorNode.size() != dimension) {
                throw EmbeddingException.fatal("Model " + model + " returned " + vectorNode.size()
                        + " dimensions, configured " + dimension);
            }
            final float[] vector = new float[dimension];
            for (int i = 0; i < dimension; i++) {
                vector[i] = (float) vectorNode.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    @Override
    public String modelId() {
        return model;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
