package com.chatbi.infrastructure.util;

import com.chatbi.domain.planning.model.aggregate.PlanningDocument;
import com.chatbi.types.enums.ResponseCode;
import com.chatbi.types.exception.AppException;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 规划文档 JSON 编解码工具。
 * <p>
 * 文档按字段序列化（snake_case），实体上的 isXxx 判定方法不会写入文档。
 * </p>
 *
 * @author chatbi
 * @since 2025-02-01
 */
@Component
public class JsonCodec {

    private final ObjectMapper documentMapper;

    /**
     * 创建 JsonCodec，基于传入的 ObjectMapper 复制出文档专用配置。
     */
    public JsonCodec(ObjectMapper objectMapper) {
        this.documentMapper = documentMapper(objectMapper);
    }

    /**
     * 读取 JSON 为规划文档。
     */
    public PlanningDocument readDocument(String json) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return documentMapper.readValue(json, PlanningDocument.class);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse planning store", ex);
        }
    }

    /**
     * 写出规划文档。
     */
    public String writeDocument(PlanningDocument document) {
        if (document == null) {
            return null;
        }
        try {
            return documentMapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write planning store", ex);
        }
    }

    /**
     * 深拷贝文档，与一次写出再读入等价。
     */
    public PlanningDocument copy(PlanningDocument document) {
        return readDocument(writeDocument(document));
    }

    private static ObjectMapper documentMapper(ObjectMapper base) {
        ObjectMapper mapper = base == null ? new ObjectMapper() : base.copy();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE);
        mapper.setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}
