package com.nosota.landregistry.dto;

import com.nosota.landregistry.api.response.TimelineEntryResponse;
import com.nosota.landregistry.api.response.TransferDocumentResponse;
import com.nosota.landregistry.api.response.TransferResponse;
import com.nosota.landregistry.model.TimelineEntry;
import com.nosota.landregistry.model.Transfer;
import com.nosota.landregistry.model.TransferDocument;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface TransferMapper {

    TransferMapper INSTANCE = Mappers.getMapper(TransferMapper.class);

    @Mapping(target = "id", source = "transfer.id")
    @Mapping(target = "documents", source = "documents")
    TransferResponse toResponse(Transfer transfer, List<TransferDocument> documents);

    TransferDocumentResponse toResponse(TransferDocument document);

    List<TransferDocumentResponse> toDocumentResponseList(List<TransferDocument> documents);

    TimelineEntryResponse toResponse(TimelineEntry entry);
}
