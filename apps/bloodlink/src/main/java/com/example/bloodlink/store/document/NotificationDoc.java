package com.example.bloodlink.store.document;

import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.store.model.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "notifications")
public class NotificationDoc implements StoredRecord {

    @Id
    private String id;

    @Indexed
    private String userUid;

    private String message;
    private NotificationType type;

    /**
     * Optional in-app route to the related request or campaign.
     */
    private String link;

    @Builder.Default
    private Boolean isRead = Boolean.FALSE;

    @Version
    private Long version;

    @Override
    public ResourceType resourceType() {
        return ResourceType.NOTIFICATION;
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
        return userUid;
    }
}
