package com.example.bloodlink.store.document;

import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.store.model.BloodGroup;
import com.example.bloodlink.store.model.Gender;
import com.example.bloodlink.store.model.UserRole;
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
 * MongoDB document for a user profile. Mirrors the external authentication record 1:1 through {@code uid}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "users")
public class UserProfileDoc implements StoredRecord {

    /**
     * Subject id from the authentication provider.
     */
    @Id
    private String uid;

    @Indexed(unique = true, sparse = true)
    private String email;

    private String firstName;
    private String lastName;
    private String phone;
    private LocalDate dob;
    private BloodGroup bloodGroup;
    private Gender gender;

    @Indexed
    @Builder.Default
    private UserRole role = UserRole.RECIPIENT;

    // Donor eligibility

    private LocalDate lastDonationDate;
    private String medicalConditions;

    @Builder.Default
    private Boolean isEligible = Boolean.TRUE;

    private LocalDate nextEligibleDate;

    @Builder.Default
    private Integer totalDonations = 0;

    @Version
    private Long version;

    @Override
    public ResourceType resourceType() {
        return ResourceType.USER;
    }

    @Override
    public String recordId() {
        return uid;
    }

    @Override
    public void assignRecordId(String id) {
        this.uid = id;
    }

    @Override
    public String ownerRef() {
        return uid;
    }
}
