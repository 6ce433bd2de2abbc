package com.remediation.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.remediation.domain.model.BlackoutWindow;
import com.remediation.entity.BlackoutWindowEntity;
import java.time.DayOfWeek;
import java.util.List;
import java.util.Set;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper
public interface BlackoutWindowMapper {

    TypeReference<Set<DayOfWeek>> DAYS = new TypeReference<>() {};
    TypeReference<Set<Long>> RUNBOOK_IDS = new TypeReference<>() {};

    @Mapping(source = "daysOfWeek", target = "daysOfWeek", qualifiedByName = "daysToJson")
    @Mapping(source = "runbookIds", target = "runbookIds", qualifiedByName = "runbookIdsToJson")
    BlackoutWindowEntity toEntity(BlackoutWindow window);

    @Mapping(source = "daysOfWeek", target = "daysOfWeek", qualifiedByName = "jsonToDays")
    @Mapping(source = "runbookIds", target = "runbookIds", qualifiedByName = "jsonToRunbookIds")
    BlackoutWindow toDomain(BlackoutWindowEntity entity);

    List<BlackoutWindow> toDomainList(List<BlackoutWindowEntity> entities);

    @Named("daysToJson")
    default String daysToJson(Set<DayOfWeek> days) {
        return JsonHelper.toJson(days, DAYS);
    }

    @Named("jsonToDays")
    default Set<DayOfWeek> jsonToDays(String json) {
        return JsonHelper.fromJson(json, DAYS);
    }

    @Named("runbookIdsToJson")
    default String runbookIdsToJson(Set<Long> runbookIds) {
        return JsonHelper.toJson(runbookIds, RUNBOOK_IDS);
    }

    @Named("jsonToRunbookIds")
    default Set<Long> jsonToRunbookIds(String json) {
        return JsonHelper.fromJson(json, RUNBOOK_IDS);
    }
}
