package com.nosota.landregistry.dto;

import com.nosota.landregistry.api.response.OwnershipRecordResponse;
import com.nosota.landregistry.api.response.PropertyResponse;
import com.nosota.landregistry.model.OwnershipRecord;
import com.nosota.landregistry.model.PropertyApplication;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface PropertyMapper {

    PropertyMapper INSTANCE = Mappers.getMapper(PropertyMapper.class);

    @Mapping(target = "kebele", source = "location.kebele")
    @Mapping(target = "subCity", source = "location.subCity")
    @Mapping(target = "latitude", source = "location.latitude")
    @Mapping(target = "longitude", source = "location.longitude")
    PropertyResponse toResponse(PropertyApplication application);

    List<PropertyResponse> toResponseList(List<PropertyApplication> applications);

    OwnershipRecordResponse toResponse(OwnershipRecord record);

    List<OwnershipRecordResponse> toOwnershipResponseList(List<OwnershipRecord> records);
}
