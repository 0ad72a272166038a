package com.greeksync.broker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greeksync.domain.model.Position;
import com.greeksync.exception.BrokerException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads positions from a JSON export instead of a live terminal session. Used for
 * offline runs against the cache.
 *
 * <p>Accepts the portfolio export ({@code {"summary": {...}, "positions": [...]}})
 * as well as a bare array of position objects. The summary block is ignored.
 */
public class JsonFilePositionSource implements PositionSource {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePositionSource.class);

    private final Path positionsFile;
    private final ObjectMapper objectMapper;

    public JsonFilePositionSource(Path positionsFile, ObjectMapper objectMapper) {
        this.positionsFile = positionsFile;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Position> fetchPositions() {
        if (!Files.exists(positionsFile)) {
            throw new BrokerException("Positions file not found: " + positionsFile);
        }
        try {
            JsonNode root = objectMapper.readTree(positionsFile.toFile());
            JsonNode array = positionsArray(root);
            if (array == null) {
                return List.of();
            }
            List<Position> positions = objectMapper.convertValue(array, new TypeReference<List<Position>>() {});
            log.info("Loaded {} positions from {}", positions.size(), positionsFile);
            return positions;
        } catch (IOException | IllegalArgumentException e) {
            throw new BrokerException("Failed to read positions from " + positionsFile, e);
        }
    }

    /** The position list of either export shape, or null for an empty document. */
    private JsonNode positionsArray(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        JsonNode positions = root.get("positions");
        if (root.isObject() && positions != null && positions.isArray()) {
            return positions;
        }
        throw new BrokerException("Positions file " + positionsFile
                + " is neither a position array nor an object with a \"positions\" array");
    }
}
