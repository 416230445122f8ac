package org.mediarr.mapper;

import org.mediarr.model.dto.ActivityLog;
import org.mediarr.model.entity.ActivityLogEntity;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface ActivityLogMapper {

    ActivityLog toDto(ActivityLogEntity entity);
}
