package com.eatsense.cache.service;

import com.eatsense.cache.model.CacheEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 缓存信封 JSON 编解码
 * 格式：{"value":...,"ttl":900,"storedAt":1700000000000}
 */
public class CacheEntryCodec {

    private final ObjectMapper objectMapper;

    public CacheEntryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> String encode(CacheEntry<T> entry) throws JsonProcessingException {
        return objectMapper.writeValueAsString(entry);
    }

    /**
     * @throws JsonProcessingException 内容无法解析或缺少必要字段
     */
    public <T> CacheEntry<T> decode(String raw, JavaType valueType) throws JsonProcessingException {
        JavaType entryType = objectMapper.getTypeFactory()
            .constructParametricType(CacheEntry.class, valueType);
        JsonNode tree = objectMapper.readTree(raw);
        requireEnvelope(tree);
        return objectMapper.treeToValue(tree, entryType);
    }

    /**
     * 仅解析信封元数据，值保持为 JSON 树（过期清理使用）
     */
    public CacheEntry<JsonNode> decodeEnvelope(String raw) throws JsonProcessingException {
        return decode(raw, objectMapper.constructType(JsonNode.class));
    }

    public JavaType typeOf(Class<?> type) {
        return objectMapper.constructType(type);
    }

    public JavaType typeOf(TypeReference<?> type) {
        return objectMapper.getTypeFactory().constructType(type);
    }

    private void requireEnvelope(JsonNode tree) throws JsonProcessingException {
        if (tree == null || !tree.isObject()
            || !tree.path("ttl").isNumber()
            || !tree.path("storedAt").isNumber()) {
            throw new MalformedEntryException("missing cache envelope fields");
        }
    }

    /**
     * 信封结构不合法
     */
    static class MalformedEntryException extends JsonProcessingException {
        MalformedEntryException(String message) {
            super(message);
        }
    }
}
