package com.promptroute.infrastructure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptroute.types.enums.ResponseCode;
import com.promptroute.types.enums.RouteChannelEnum;
import com.promptroute.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 编解码工具，负责 PO 中 JSON 列的读写。
 *
 * @author promptroute
 * @since 2026-10-01
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Double>> DOUBLE_MAP_REF = new TypeReference<Map<String, Double>>() {};
    private static final TypeReference<List<String>> STRING_LIST_REF = new TypeReference<List<String>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取 JSON 为 String List。
     */
    public List<String> readStringList(String json) {
        return readValue(json, STRING_LIST_REF);
    }

    /**
     * 通道分数以通道 code 为键写出。
     */
    public String writeChannelScores(Map<RouteChannelEnum, Double> scores) {
        if (scores == null) {
            return null;
        }
        Map<String, Double> byCode = new LinkedHashMap<>();
        scores.forEach((channel, value) -> byCode.put(channel.getCode(), value));
        return writeValue(byCode);
    }

    public Map<RouteChannelEnum, Double> readChannelScores(String json) {
        Map<RouteChannelEnum, Double> scores = new EnumMap<>(RouteChannelEnum.class);
        Map<String, Double> byCode = readValue(json, DOUBLE_MAP_REF);
        if (byCode != null) {
            byCode.forEach((code, value) -> scores.put(RouteChannelEnum.fromText(code), value));
        }
        return scores;
    }

    /**
     * 读取 JSON 为指定类型。
     */
    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    public <T> T readValue(String json, Class<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    /**
     * 写出为 JSON 字符串。
     */
    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }
}
