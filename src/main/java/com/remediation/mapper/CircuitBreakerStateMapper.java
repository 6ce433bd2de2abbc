package com.remediation.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.remediation.domain.model.CircuitBreakerState;
import com.remediation.entity.CircuitBreakerStateEntity;
import java.util.ArrayList;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between CircuitBreakerState and CircuitBreakerStateEntity.
 */
@Mapper
public interface CircuitBreakerStateMapper {

    TypeReference<List<String>> ID_LIST = new TypeReference<>() {};

    @Mapping(source = "recentExecutionIds", target = "recentExecutionIds", qualifiedByName = "idsToJson")
    CircuitBreakerStateEntity toEntity(CircuitBreakerState state);

    @Mapping(source = "recentExecutionIds", target = "recentExecutionIds", qualifiedByName = "jsonToIds")
    CircuitBreakerState toDomain(CircuitBreakerStateEntity entity);

    @Named("idsToJson")
    default String idsToJson(List<String> ids) {
        return JsonHelper.toJson(ids != null ? ids : List.of(), ID_LIST);
    }

    @Named("jsonToIds")
    default List<String> jsonToIds(String json) {
        List<String> ids = JsonHelper.fromJson(json, ID_LIST);
        return ids != null ? new ArrayList<>(ids) : new ArrayList<>();
    }
}
