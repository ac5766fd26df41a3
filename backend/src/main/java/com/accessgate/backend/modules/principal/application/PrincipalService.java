package com.accessgate.backend.modules.principal.application;

import java.util.Locale;
import java.util.UUID;

import com.accessgate.backend.global.error.ProblemException;
import com.accessgate.backend.modules.principal.domain.Principal;
import com.accessgate.backend.modules.principal.infrastructure.persistence.PrincipalRepository;
import com.accessgate.backend.modules.principal.presentation.dto.PrincipalPageResponse;
import com.accessgate.backend.modules.principal.presentation.dto.PrincipalProfileResponse;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class PrincipalService {

    private final PrincipalRepository principalRepository;

    public PrincipalService(PrincipalRepository principalRepository) {
        this.principalRepository = principalRepository;
    }

    public PrincipalProfileResponse loadProfile(UUID principalId) {
        Principal principal = principalRepository.findWithRolesByExternalId(principalId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User " + principalId + " not found"));
        return PrincipalProfileResponse.from(principal);
    }

    public PrincipalPageResponse listPrincipals(String search, Pageable pageable) {
        String pattern = search == null || search.isBlank()
                ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        Page<Principal> result = principalRepository.search(pattern, pageable);
        return new PrincipalPageResponse(
                result.getContent().stream().map(PrincipalProfileResponse::from).toList(),
                result.getNumber(),
                result.getSize(),
                result.getTotalElements()
        );
    }
}
