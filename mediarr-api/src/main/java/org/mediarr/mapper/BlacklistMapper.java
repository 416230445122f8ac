package org.mediarr.mapper;

import org.mediarr.model.dto.BlacklistEntry;
import org.mediarr.model.entity.ReleaseBlacklistEntity;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface BlacklistMapper {

    BlacklistEntry toDto(ReleaseBlacklistEntity entity);

    List<BlacklistEntry> toDtos(List<ReleaseBlacklistEntity> entities);
}
