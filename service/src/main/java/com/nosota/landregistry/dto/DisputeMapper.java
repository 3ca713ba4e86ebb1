package com.nosota.landregistry.dto;

import com.nosota.landregistry.api.model.DisputePriority;
import com.nosota.landregistry.api.response.DisputeResponse;
import com.nosota.landregistry.api.response.TimelineEntryResponse;
import com.nosota.landregistry.model.Dispute;
import com.nosota.landregistry.model.TimelineEntry;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

@Mapper
public interface DisputeMapper {

    DisputeMapper INSTANCE = Mappers.getMapper(DisputeMapper.class);

    /**
     * @param priority Priority computed at read time, never stored on the dispute
     */
    @Mapping(target = "priority", source = "priority")
    DisputeResponse toResponse(Dispute dispute, DisputePriority priority);

    TimelineEntryResponse toResponse(TimelineEntry entry);
}
