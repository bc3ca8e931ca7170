package com.example.bloodlink.store.document;

import com.example.bloodlink.authz.abac.model.LifecycleStatus;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.common.exception.InvalidRecordException;
import com.example.bloodlink.store.model.BloodGroup;
import com.example.bloodlink.store.model.RequestStatus;
import com.example.bloodlink.store.model.UrgencyLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * MongoDB document for a request for blood, owned by the user who submitted it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "blood_requests")
public class BloodRequestDoc implements StoredRecord {

    @Id
    private String id;

    /**
     * The uid of the user who submitted the request.
     */
    @Indexed
    private String requesterUid;

    /**
     * Denormalized for display.
     */
    private String requesterName;

    private String patientName;
    private BloodGroup requiredBloodGroup;

    @Builder.Default
    private Integer unitsRequired = 1;

    @Builder.Default
    private Integer unitsFulfilled = 0;

    @Builder.Default
    private UrgencyLevel urgency = UrgencyLevel.MEDIUM;

    private String hospitalName;
    private String hospitalLocation;
    private String contactPhone;
    private String additionalDetails;

    @Indexed
    @Builder.Default
    private RequestStatus status = RequestStatus.PENDING_VERIFICATION;

    @Version
    private Long version;

    @Override
    public ResourceType resourceType() {
        return ResourceType.BLOOD_REQUEST;
    }

    @Override
    public String recordId() {
        return id;
    }

    @Override
    public void assignRecordId(String id) {
        this.id = id;
    }

    @Override
    public String ownerRef() {
        return requesterUid;
    }

    @Override
    public LifecycleStatus lifecycleStatus() {
        return status;
    }

    @Override
    public void checkConstraints() {
        if (unitsRequired == null || unitsRequired <= 0) {
            throw new InvalidRecordException(ResourceType.BLOOD_REQUEST, "unitsRequired",
                    "Units required must be greater than zero");
        }
        if (unitsFulfilled != null && unitsFulfilled < 0) {
            throw new InvalidRecordException(ResourceType.BLOOD_REQUEST, "unitsFulfilled",
                    "Units fulfilled must not be negative");
        }
    }
}
