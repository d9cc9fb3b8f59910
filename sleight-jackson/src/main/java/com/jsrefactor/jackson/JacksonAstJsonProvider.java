package com.jsrefactor.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jsrefactor.ast.Node;
import com.jsrefactor.ast.Program;
import com.jsrefactor.config.RefactoringConfig;
import com.jsrefactor.json.AstJsonDeserializer;
import com.jsrefactor.json.AstJsonException;
import com.jsrefactor.json.AstJsonProvider;
import com.jsrefactor.json.AstJsonSerializer;
import com.jsrefactor.json.RefactoringConfigReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {
    private static final Logger LOG = LoggerFactory.getLogger(JacksonAstJsonProvider.class);

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;
    private final RefactoringConfigReader configReader;

    public JacksonAstJsonProvider() {
        this(SleightJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
        this.configReader = new JacksonConfigReader(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public RefactoringConfigReader getConfigReader() {
        return configReader;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Program deserializeProgram(String json) throws AstJsonException {
            return deserialize(json, Program.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }

    private static class JacksonConfigReader implements RefactoringConfigReader {
        private final ObjectMapper mapper;

        JacksonConfigReader(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public RefactoringConfig read(String json) throws AstJsonException {
            JsonNode overrides;
            try {
                overrides = mapper.readTree(json);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Refactoring configuration is not valid JSON", e);
            }
            if (overrides == null || !overrides.isObject()) {
                throw new AstJsonException("Refactoring configuration must be a JSON object");
            }

            ObjectNode merged = mapper.valueToTree(RefactoringConfig.defaults());
            merged.setAll((ObjectNode) overrides);
            try {
                RefactoringConfig config = mapper.treeToValue(merged, RefactoringConfig.class);
                LOG.debug("Read refactoring configuration {}", config);
                return config;
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Invalid refactoring configuration: " + e.getOriginalMessage(), e);
            }
        }

        @Override
        public String write(RefactoringConfig config) throws AstJsonException {
            try {
                return mapper.writeValueAsString(config);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize refactoring configuration", e);
            }
        }
    }
}
