package com.nosota.landregistry.service;

import com.nosota.landregistry.api.model.DocumentStatus;
import com.nosota.landregistry.api.model.DocumentType;
import com.nosota.landregistry.api.model.PaymentStatus;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.model.PaymentVerificationStatus;
import com.nosota.landregistry.api.model.PropertyStatus;
import com.nosota.landregistry.api.model.PropertyType;
import com.nosota.landregistry.config.RegistryProperties;
import com.nosota.landregistry.dto.AggregateFlags;
import com.nosota.landregistry.model.Document;
import com.nosota.landregistry.model.Payment;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Pure projection of an application's documents and payments onto its derived flags and status.
 *
 * <p>Nothing here reads or writes the database. Callers pass in the rows they re-read under the
 * application lock and write the result back themselves.
 *
 * <p>Rules:
 * <ul>
 *   <li>documentsValidated: every required type is present, every document of a required type is
 *       VERIFIED, and no document of the application is REJECTED</li>
 *   <li>paymentCompleted: some REGISTRATION_FEE payment is COMPLETED and VERIFIED</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class AggregateStatusProjection {

    public static final String DOCUMENTS_NOT_VALIDATED = "documents not yet validated";
    public static final String PAYMENT_NOT_COMPLETED = "registration fee not yet verified";

    private final RegistryProperties registryProperties;

    public AggregateFlags project(PropertyType propertyType, List<Document> documents, List<Payment> payments) {
        return new AggregateFlags(
                documentsValidated(propertyType, documents),
                paymentCompleted(payments));
    }

    public boolean documentsValidated(PropertyType propertyType, List<Document> documents) {
        Set<DocumentType> required = registryProperties.documents().requiredFor(propertyType);

        Set<DocumentType> present = EnumSet.noneOf(DocumentType.class);
        for (Document document : documents) {
            if (document.getStatus() == DocumentStatus.REJECTED) {
                return false;
            }
            if (required.contains(document.getDocumentType())) {
                if (document.getStatus() != DocumentStatus.VERIFIED) {
                    return false;
                }
                present.add(document.getDocumentType());
            }
        }
        return present.containsAll(required);
    }

    public boolean paymentCompleted(List<Payment> payments) {
        return payments.stream().anyMatch(payment ->
                payment.getPaymentType() == PaymentType.REGISTRATION_FEE
                        && payment.getStatus() == PaymentStatus.COMPLETED
                        && payment.getVerificationStatus() == PaymentVerificationStatus.VERIFIED);
    }

    /**
     * Status of an application given its flags. Terminal statuses are never derived away.
     */
    public PropertyStatus deriveStatus(PropertyStatus current, AggregateFlags flags, boolean reviewStarted) {
        if (current != null && current.isTerminal()) {
            return current;
        }
        if (flags.readyForApproval()) {
            return PropertyStatus.PAYMENT_COMPLETED;
        }
        if (flags.documentsValidated()) {
            return PropertyStatus.DOCUMENTS_VALIDATED;
        }
        return reviewStarted ? PropertyStatus.UNDER_REVIEW : PropertyStatus.PENDING;
    }

    /**
     * Conditions still blocking approval, in a stable order. Empty when ready.
     */
    public List<String> missingConditions(AggregateFlags flags) {
        List<String> missing = new ArrayList<>();
        if (!flags.documentsValidated()) {
            missing.add(DOCUMENTS_NOT_VALIDATED);
        }
        if (!flags.paymentCompleted()) {
            missing.add(PAYMENT_NOT_COMPLETED);
        }
        return missing;
    }

    /**
     * Document types required for the property type that have no document uploaded yet.
     */
    public Set<DocumentType> missingDocumentTypes(PropertyType propertyType, List<Document> documents) {
        Set<DocumentType> missing = EnumSet.copyOf(registryProperties.documents().requiredFor(propertyType));
        documents.forEach(document -> missing.remove(document.getDocumentType()));
        return missing;
    }
}
