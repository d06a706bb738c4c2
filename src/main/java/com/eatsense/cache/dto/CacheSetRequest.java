package com.eatsense.cache.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 写入缓存请求
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CacheSetRequest {

    /** 任意 JSON 值 */
    private JsonNode value;

    /** TTL（秒），为空时按命名空间解析 */
    private Integer ttl;
}
