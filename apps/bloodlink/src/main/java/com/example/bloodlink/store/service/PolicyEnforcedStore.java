package com.example.bloodlink.store.service;

import com.example.bloodlink.authz.abac.model.Action;
import com.example.bloodlink.authz.abac.model.ResourceAttributes;
import com.example.bloodlink.authz.abac.model.ResourceAttributes.ResourceType;
import com.example.bloodlink.authz.abac.model.SubjectAttributes;
import com.example.bloodlink.authz.abac.service.AbacAuthorizationService;
import com.example.bloodlink.common.exception.InvalidRecordException;
import com.example.bloodlink.common.exception.PolicyDeniedException;
import com.example.bloodlink.common.exception.RecordNotFoundException;
import com.example.bloodlink.common.exception.StaleRecordException;
import com.example.bloodlink.store.document.StoredRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;

/**
 * Record store for one resource type that asks the access policy before every read and write.
 *
 * <ul>
 *   <li>Single reads fail with {@link PolicyDeniedException}; list reads drop denied records one by one.</li>
 *   <li>Writes are all or nothing: a denied write is never partially applied.</li>
 *   <li>Updates and deletes are checked against the version that was read and written with that
 *       version, so a record that changed in between fails with {@link StaleRecordException}.</li>
 * </ul>
 *
 * @param <D> the persisted record type
 */
@Slf4j
public class PolicyEnforcedStore<D extends StoredRecord> {

    private final ResourceType resourceType;
    private final ReactiveMongoRepository<D, String> repository;
    private final AbacAuthorizationService authorizationService;
    private final RecordFieldExtractor fieldExtractor;

    @Nullable
    private final Function<String, Flux<D>> ownerQuery;

    public PolicyEnforcedStore(
            ResourceType resourceType,
            ReactiveMongoRepository<D, String> repository,
            AbacAuthorizationService authorizationService,
            RecordFieldExtractor fieldExtractor,
            @Nullable Function<String, Flux<D>> ownerQuery) {
        this.resourceType = resourceType;
        this.repository = repository;
        this.authorizationService = authorizationService;
        this.fieldExtractor = fieldExtractor;
        this.ownerQuery = ownerQuery;
    }

    public Mono<D> create(SubjectAttributes subject, D record) {
        return Mono.defer(() -> {
            if (record.resourceType() != resourceType) {
                return Mono.<D>error(wrongType(record));
            }
            record.setVersion(null);
            ResourceAttributes resource = ResourceAttributes.proposed(resourceType, record.recordId(),
                    record.ownerRef(), record.lifecycleStatus(), fieldExtractor.fieldsOf(record));

            return authorizationService.enforce(subject, resource, Action.CREATE)
                    .then(Mono.fromRunnable(record::checkConstraints))
                    .then(Mono.defer(() -> repository.save(record)));
        })
                .doOnError(DataAccessException.class,
                        e -> authorizationService.recordError(subject, resourceType, record.recordId(), Action.CREATE, e))
                .doOnNext(saved -> log.info("Created {} {} for subject={}",
                        resourceType.displayName(), saved.recordId(), subject.displayId()));
    }

    public Mono<D> findById(SubjectAttributes subject, String id) {
        return load(id)
                .flatMap(record -> authorizationService.enforce(subject, storedResource(record), Action.READ)
                        .thenReturn(record))
                .doOnError(DataAccessException.class,
                        e -> authorizationService.recordError(subject, resourceType, id, Action.READ, e));
    }

    /**
     * All records the subject may read. Records the subject may not read are silently left out.
     */
    public Flux<D> findAll(SubjectAttributes subject) {
        return readable(subject, repository.findAll());
    }

    /**
     * Records owned by a user that the subject may read.
     *
     * @throws UnsupportedOperationException if this resource type has no owner
     */
    public Flux<D> findAllByOwner(SubjectAttributes subject, String ownerId) {
        if (ownerQuery == null) {
            return Flux.error(new UnsupportedOperationException(
                    resourceType.displayName() + " records have no owner"));
        }
        return readable(subject, ownerQuery.apply(ownerId));
    }

    /**
     * Replace a stored record. The proposed record's identity key defaults to {@code id};
     * a different key is rejected by the policy as an identity change.
     */
    public Mono<D> update(SubjectAttributes subject, String id, D proposed) {
        if (proposed.resourceType() != resourceType) {
            return Mono.error(wrongType(proposed));
        }
        return load(id)
                .flatMap(current -> {
                    if (proposed.recordId() == null) {
                        proposed.assignRecordId(id);
                    }
                    proposed.setVersion(current.getVersion());

                    Map<String, Object> currentFields = fieldExtractor.fieldsOf(current);
                    ResourceAttributes resource = ResourceAttributes.change(resourceType, id,
                            current.ownerRef(), current.lifecycleStatus(),
                            currentFields, fieldExtractor.fieldsOf(proposed));

                    return authorizationService.enforce(subject, resource, Action.UPDATE)
                            .then(Mono.fromRunnable(proposed::checkConstraints))
                            .then(Mono.defer(() -> repository.save(proposed)));
                })
                .onErrorMap(OptimisticLockingFailureException.class,
                        e -> new StaleRecordException(resourceType, id, e))
                .doOnError(DataAccessException.class,
                        e -> authorizationService.recordError(subject, resourceType, id, Action.UPDATE, e))
                .doOnNext(saved -> log.info("Updated {} {} for subject={}",
                        resourceType.displayName(), id, subject.displayId()));
    }

    public Mono<Void> delete(SubjectAttributes subject, String id) {
        return load(id)
                .flatMap(record -> authorizationService.enforce(subject, storedResource(record), Action.DELETE)
                        .then(Mono.defer(() -> repository.delete(record))))
                .onErrorMap(OptimisticLockingFailureException.class,
                        e -> new StaleRecordException(resourceType, id, e))
                .doOnError(DataAccessException.class,
                        e -> authorizationService.recordError(subject, resourceType, id, Action.DELETE, e))
                .doOnSuccess(ignored -> log.info("Deleted {} {} for subject={}",
                        resourceType.displayName(), id, subject.displayId()));
    }

    private InvalidRecordException wrongType(D record) {
        return new InvalidRecordException(resourceType, "resourceType", String.format(
                "%s record cannot be written to the %s store",
                record.resourceType().displayName(), resourceType.displayName()));
    }

    private Mono<D> load(String id) {
        return repository.findById(id)
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException(resourceType, id)));
    }

    private Flux<D> readable(SubjectAttributes subject, Flux<D> records) {
        return records.filter(record -> authorizationService
                .decide(subject, storedResource(record), Action.READ)
                .isAllowed());
    }

    private ResourceAttributes storedResource(D record) {
        return ResourceAttributes.stored(resourceType, record.recordId(), record.ownerRef(),
                record.lifecycleStatus(), fieldExtractor.fieldsOf(record));
    }
}
