package com.example.bloodlink.store.document;

import com.example.bloodlink.authz.abac.model.LifecycleStatus;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.common.exception.InvalidRecordException;
import com.example.bloodlink.store.model.BloodGroup;
import com.example.bloodlink.store.model.CampaignStatus;
import com.example.bloodlink.store.model.GeoPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * MongoDB document for a donation drive or event.
 * Unit counters are maintained by the campaign workflow, not by this store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "campaigns")
@CompoundIndex(name = "dates_idx", def = "{'startDate': 1, 'endDate': 1}")
public class CampaignDoc implements StoredRecord {

    @Id
    private String id;

    private String title;
    private String description;
    private String organizer;
    private Instant startDate;
    private Instant endDate;

    /**
     * Free-form schedule, e.g. "10:00 AM - 4:00 PM Daily".
     */
    private String timeDetails;

    private String location;
    private GeoPoint locationCoords;
    private String imageUrl;

    @Builder.Default
    private Integer goalUnits = 0;

    @Builder.Default
    private Integer collectedUnits = 0;

    @Indexed
    @Builder.Default
    private CampaignStatus status = CampaignStatus.UPCOMING;

    @Builder.Default
    private Integer participantsCount = 0;

    private List<BloodGroup> requiredBloodGroups;

    @Version
    private Long version;

    @Override
    public ResourceType resourceType() {
        return ResourceType.CAMPAIGN;
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
    public LifecycleStatus lifecycleStatus() {
        return status;
    }

    @Override
    public void checkConstraints() {
        if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
            throw new InvalidRecordException(ResourceType.CAMPAIGN, "endDate",
                    "Campaign end date must not be before its start date");
        }
        requireNonNegative("goalUnits", goalUnits);
        requireNonNegative("collectedUnits", collectedUnits);
        requireNonNegative("participantsCount", participantsCount);
    }

    private static void requireNonNegative(String field, Integer value) {
        if (value != null && value < 0) {
            throw new InvalidRecordException(ResourceType.CAMPAIGN, field, field + " must not be negative");
        }
    }
}
