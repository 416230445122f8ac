package org.mediarr.mapper;

import org.mediarr.model.dto.Download;
import org.mediarr.model.entity.DownloadEntity;
import org.mapstruct.Mapper;

import java.util.List;

@Mapper(componentModel = "spring")
public interface DownloadMapper {

    Download toDto(DownloadEntity entity);

    List<Download> toDtos(List<DownloadEntity> entities);
}
