package com.thevig.backend.mapper;

import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftPick;
import com.thevig.backend.domain.entity.DraftSettings;
import com.thevig.backend.dto.DraftDTO;
import com.thevig.backend.dto.DraftPickDTO;
import com.thevig.backend.dto.DraftSettingsDTO;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface DraftMapper {

    @Mapping(target = "participantCount", expression = "java(draft.participantCount())")
    DraftDTO toDto(Draft draft);

    @Mapping(target = "resourceName", ignore = true)
    DraftPickDTO toDto(DraftPick pick);

    List<DraftPickDTO> toPickDtos(List<DraftPick> picks);

    DraftSettingsDTO toDto(DraftSettings settings);
}
