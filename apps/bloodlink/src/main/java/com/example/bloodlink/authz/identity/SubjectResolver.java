package com.example.bloodlink.authz.identity;

import com.example.bloodlink.authz.abac.model.SubjectAttributes;
import com.example.bloodlink.common.util.StringSanitizer;
import com.example.bloodlink.store.model.UserRole;
import com.example.bloodlink.store.repository.UserProfileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Resolves the caller once per request: subject id from the authentication provider,
 * role from the caller's own user profile.
 *
 * <p>A caller without a profile yet (signup in progress) gets the default RECIPIENT role,
 * so the policy lets it create its own profile.
 */
@Slf4j
@Service
public class SubjectResolver {

    private final UserProfileRepository userProfileRepository;

    public SubjectResolver(UserProfileRepository userProfileRepository) {
        this.userProfileRepository = userProfileRepository;
    }

    /**
     * @param subjectId authenticated subject id, or null/blank for an anonymous caller
     * @return Mono emitting the subject attributes; never empty
     */
    public Mono<SubjectAttributes> resolve(String subjectId) {
        if (subjectId == null || subjectId.isBlank()) {
            return Mono.just(SubjectAttributes.anonymous());
        }
        if (!StringSanitizer.isValidSubjectId(subjectId)) {
            log.warn("Rejected malformed subject id: {}", StringSanitizer.forLog(subjectId));
            return Mono.just(SubjectAttributes.anonymous());
        }

        return userProfileRepository.findById(subjectId)
                .map(profile -> SubjectAttributes.of(subjectId,
                        profile.getRole() != null ? profile.getRole() : UserRole.RECIPIENT))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("No profile for subject {}, resolving with default role", subjectId);
                    return SubjectAttributes.of(subjectId, UserRole.RECIPIENT);
                }))
                .doOnNext(subject -> log.debug("Resolved subject: id={}, role={}",
                        subject.subjectId(), subject.role()));
    }
}
