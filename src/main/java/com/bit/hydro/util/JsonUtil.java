package com.bit.hydro.util;

import com.bit.hydro.exception.ErrorType;
import com.bit.hydro.exception.HydroException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * 存储值序列化 BigDecimal 按普通数字写出，避免科学计数法
 */
public class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

    public static byte[] toBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new HydroException(ErrorType.STORAGE, "序列化失败: " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromBytes(byte[] bytes, Class<T> type) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException e) {
            throw new HydroException(ErrorType.STORAGE, "反序列化失败: " + type.getSimpleName(), e);
        }
    }

    public static <T> T fromBytes(byte[] bytes, TypeReference<T> type) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (IOException e) {
            throw new HydroException(ErrorType.STORAGE, "反序列化失败: " + type.getType(), e);
        }
    }
}
