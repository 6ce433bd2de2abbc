package com.remediation.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.remediation.domain.model.Execution;
import com.remediation.domain.model.Runbook;
import com.remediation.entity.ExecutionEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between Execution and ExecutionEntity.
 *
 * <p>The runbook snapshot and the variables are JSON in the entity.
 */
@Mapper
public interface ExecutionMapper {

    TypeReference<Map<String, String>> VARIABLES = new TypeReference<>() {};

    @Mapping(source = "runbookSnapshot", target = "runbookSnapshot", qualifiedByName = "runbookToJson")
    @Mapping(source = "variables", target = "variables", qualifiedByName = "variablesToJson")
    ExecutionEntity toEntity(Execution execution);

    @Mapping(source = "runbookSnapshot", target = "runbookSnapshot", qualifiedByName = "jsonToRunbook")
    @Mapping(source = "variables", target = "variables", qualifiedByName = "jsonToVariables")
    Execution toDomain(ExecutionEntity entity);

    List<Execution> toDomainList(List<ExecutionEntity> entities);

    @Named("runbookToJson")
    default String runbookToJson(Runbook runbook) {
        return JsonHelper.toJson(runbook);
    }

    @Named("jsonToRunbook")
    default Runbook jsonToRunbook(String json) {
        return JsonHelper.fromJson(json, Runbook.class);
    }

    @Named("variablesToJson")
    default String variablesToJson(Map<String, String> variables) {
        return JsonHelper.toJson(variables, VARIABLES);
    }

    @Named("jsonToVariables")
    default Map<String, String> jsonToVariables(String json) {
        Map<String, String> variables = JsonHelper.fromJson(json, VARIABLES);
        return variables != null ? variables : Map.of();
    }
}
