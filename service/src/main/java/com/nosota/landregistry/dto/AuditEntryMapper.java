package com.nosota.landregistry.dto;

import com.nosota.landregistry.api.response.AuditEntryResponse;
import com.nosota.landregistry.model.AuditEntry;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface AuditEntryMapper {

    AuditEntryMapper INSTANCE = Mappers.getMapper(AuditEntryMapper.class);

    AuditEntryResponse toResponse(AuditEntry entry);

    List<AuditEntryResponse> toResponseList(List<AuditEntry> entries);
}
