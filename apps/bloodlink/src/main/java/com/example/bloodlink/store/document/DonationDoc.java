package com.example.bloodlink.store.document;

import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.store.model.DonationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * MongoDB document for one recorded donation. Recorded by staff, read by the donor.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "donations")
public class DonationDoc implements StoredRecord {

    @Id
    private String id;

    @Indexed
    private String donorUid;

    @Indexed
    private LocalDate donationDate;

    private DonationType donationType;

    /**
     * Blood bank name or campaign title, as shown in the donor's history.
     */
    private String locationName;

    private String campaignId;
    private String bloodBankId;
    private String notes;

    @Version
    private Long version;

    @Override
    public ResourceType resourceType() {
        return ResourceType.DONATION;
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
        return donorUid;
    }
}
