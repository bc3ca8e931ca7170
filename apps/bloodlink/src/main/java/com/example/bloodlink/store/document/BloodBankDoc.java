package com.example.bloodlink.store.document;

import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.store.model.GeoPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "blood_banks")
public class BloodBankDoc implements StoredRecord {

    @Id
    private String id;

    private String name;
    private String location;
    private GeoPoint locationCoords;
    private String contactPhone;
    private String operatingHours;
    private String website;

    /**
     * Units on hand keyed by blood group label, e.g. {"A+": 10, "O-": 5}.
     */
    private Map<String, Integer> inventory;

    private Instant lastInventoryUpdate;
    private List<String> servicesOffered;

    @Version
    private Long version;

    @Override
    public ResourceType resourceType() {
        return ResourceType.BLOOD_BANK;
    }

    @Override
    public String recordId() {
        return id;
    }

    @Override
    public void assignRecordId(String id) {
        this.id = id;
    }
}
