package offlinecache.domain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import offlinecache.domain.exceptions.DeserializationFailed;
import offlinecache.domain.exceptions.SerializationFailed;

import java.util.Map;
import java.util.logging.Logger;

/**
 * A service for serializing and deserializing JSON.
 */
@ApplicationScoped
public class JsonDeserializerJackson implements JsonDeserializer {

    @Inject
    private Logger logger;

    private ObjectMapper objectMapper;

    @PostConstruct
    private void init() {
        objectMapper = new ObjectMapper();
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public String serialize(final Object object) {
        return Try.of(() -> objectMapper.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + object.getClass().getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new SerializationFailed(ex));
    }

    @Override
    public <T> T deserialize(final String json, final Class<T> clazz) {
        return Try.of(() -> objectMapper.readValue(json, clazz))
                .onFailure(ex -> logger.warning("Failed to deserialize object of type " + clazz.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }

    @Override
    public <U, V> Map<U, V> deserializeMap(final String json, final Class<U> key, final Class<V> value) {
        return Try.of(() -> objectMapper.<Map<U, V>>readValue(
                        json,
                        objectMapper.getTypeFactory().constructMapType(Map.class, key, value)))
                .onFailure(ex -> logger.warning("Failed to deserialize map of type " + key.getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new DeserializationFailed(ex));
    }
}
