package org.mediarr.mapper;

import org.apache.commons.lang3.StringUtils;
import org.mediarr.model.dto.CachedRelease;
import org.mediarr.model.entity.RssReleaseEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.util.Arrays;
import java.util.List;

@Mapper(componentModel = "spring")
public interface RssReleaseMapper {

    @Mapping(source = "categories", target = "categories", qualifiedByName = "splitCategories")
    CachedRelease toDto(RssReleaseEntity entity);

    List<CachedRelease> toDtos(List<RssReleaseEntity> entities);

    @Named("splitCategories")
    default List<String> splitCategories(String categories) {
        if (StringUtils.isBlank(categories)) {
            return List.of();
        }
        return Arrays.stream(categories.split(",")).map(String::trim).filter(StringUtils::isNotEmpty).toList();
    }
}
