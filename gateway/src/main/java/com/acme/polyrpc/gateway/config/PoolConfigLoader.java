package com.acme.polyrpc.gateway.config;

import com.acme.polyrpc.gateway.routing.PoolConfig;
import com.acme.polyrpc.gateway.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads pool descriptors from JSON:
 * <pre>{ "pools": [ { "pid": "py", "modules": ["calc"], "workers": ["127.0.0.1:9101"] } ] }</pre>
 * A bare top-level array of descriptors is accepted too. Order is preserved, which
 * decides who wins a module claimed twice.
 */
public final class PoolConfigLoader {
    private PoolConfigLoader() {
    }

    public static List<PoolConfig> load(Path file) {
        JsonNode root;
        try {
            root = JsonCodec.readTree(file);
        } catch (IOException e) {
            throw new GatewayConfigException("Cannot read pool descriptors from " + file, e);
        }
        return parse(root);
    }

    public static List<PoolConfig> parse(String json) {
        try {
            return parse(JsonCodec.readTree(json));
        } catch (IOException e) {
            throw new GatewayConfigException("Malformed pool descriptor JSON", e);
        }
    }

    static List<PoolConfig> parse(JsonNode root) {
        JsonNode pools = root != null && root.isObject() ? root.get("pools") : root;
        if (pools == null || !pools.isArray()) {
            throw new GatewayConfigException("Expected an array of pool descriptors");
        }
        List<PoolConfig> out = new ArrayList<>(pools.size());
        for (int i = 0; i < pools.size(); i++) {
            JsonNode pool = pools.get(i);
            JsonNode pid = pool.get("pid");
            if (pid == null || !pid.isTextual() || pid.asText().isBlank()) {
                throw new GatewayConfigException("Pool descriptor #" + i + " has no pid");
            }
            out.add(new PoolConfig(
                pid.asText(),
                stringList(pool, "modules", i),
                stringList(pool, "workers", i)
            ));
        }
        return List.copyOf(out);
    }

    private static List<String> stringList(JsonNode pool, String field, int index) {
        JsonNode node = pool.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new GatewayConfigException("Pool descriptor #" + index + ": '" + field + "' must be an array");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode value : node) {
            if (!value.isTextual()) {
                throw new GatewayConfigException("Pool descriptor #" + index + ": '" + field + "' must hold strings");
            }
            values.add(value.asText());
        }
        return values;
    }
}
