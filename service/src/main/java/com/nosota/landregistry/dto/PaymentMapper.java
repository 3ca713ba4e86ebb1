package com.nosota.landregistry.dto;

import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.response.FeeQuoteResponse;
import com.nosota.landregistry.api.response.PaymentResponse;
import com.nosota.landregistry.model.Payment;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;
import java.util.UUID;

@Mapper
public interface PaymentMapper {

    PaymentMapper INSTANCE = Mappers.getMapper(PaymentMapper.class);

    PaymentResponse toResponse(Payment payment);

    List<PaymentResponse> toResponseList(List<Payment> payments);

    @Mapping(target = "paymentType", source = "paymentType")
    @Mapping(target = "scopeId", source = "scopeId")
    FeeQuoteResponse toResponse(FeeQuote quote, PaymentType paymentType, UUID scopeId);
}
