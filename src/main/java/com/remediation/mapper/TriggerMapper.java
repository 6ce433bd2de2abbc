package com.remediation.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.remediation.domain.model.Trigger;
import com.remediation.entity.TriggerEntity;
import com.remediation.matching.TriggerConstraint;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between Trigger and TriggerEntity. Constraints travel as a JSON array with a
 * {@code kind} discriminator per element.
 */
@Mapper
public interface TriggerMapper {

    TypeReference<List<TriggerConstraint>> CONSTRAINT_LIST = new TypeReference<>() {};

    @Mapping(source = "constraints", target = "constraints", qualifiedByName = "constraintsToJson")
    TriggerEntity toEntity(Trigger trigger);

    @Mapping(source = "constraints", target = "constraints", qualifiedByName = "jsonToConstraints")
    Trigger toDomain(TriggerEntity entity);

    List<Trigger> toDomainList(List<TriggerEntity> entities);

    @Named("constraintsToJson")
    default String constraintsToJson(List<TriggerConstraint> constraints) {
        return JsonHelper.toJson(constraints != null ? constraints : List.of(), CONSTRAINT_LIST);
    }

    @Named("jsonToConstraints")
    default List<TriggerConstraint> jsonToConstraints(String json) {
        List<TriggerConstraint> constraints = JsonHelper.fromJson(json, CONSTRAINT_LIST);
        return constraints != null ? List.copyOf(constraints) : List.of();
    }
}
