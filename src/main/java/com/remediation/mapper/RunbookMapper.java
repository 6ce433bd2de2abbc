package com.remediation.mapper;

import com.remediation.domain.model.RateLimitPolicy;
import com.remediation.domain.model.Runbook;
import com.remediation.entity.RunbookEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between Runbook and RunbookEntity. The rate limit policy is flattened into two
 * nullable columns; both must be set for the runbook to carry its own policy.
 */
@Mapper
public interface RunbookMapper {

    @Mapping(source = "rateLimit.maxExecutions", target = "rateLimitMaxExecutions")
    @Mapping(source = "rateLimit.windowSeconds", target = "rateLimitWindowSeconds")
    RunbookEntity toEntity(Runbook runbook);

    @Mapping(source = "entity", target = "rateLimit", qualifiedByName = "toRateLimit")
    Runbook toDomain(RunbookEntity entity);

    @Named("toRateLimit")
    default RateLimitPolicy toRateLimit(RunbookEntity entity) {
        if (entity.getRateLimitMaxExecutions() == null || entity.getRateLimitWindowSeconds() == null) {
            return null;
        }
        return RateLimitPolicy.builder()
                .maxExecutions(entity.getRateLimitMaxExecutions())
                .windowSeconds(entity.getRateLimitWindowSeconds())
                .build();
    }
}
