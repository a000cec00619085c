package com.heist.backend.controller;

import com.heist.backend.exception.NotFoundException;
import com.heist.backend.model.ContractAudit;
import com.heist.backend.service.audit.ContractAuditor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cache lookups only. Reading an audit here never triggers collaborator calls.
 */
@RestController
@RequestMapping("/api/audits")
@RequiredArgsConstructor
public class AuditController {

    private final ContractAuditor contractAuditor;

    @GetMapping("/{chain}/{address}")
    public ResponseEntity<ContractAudit> cachedAudit(@PathVariable String chain, @PathVariable String address) {
        return contractAuditor.cached(address, chain)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No cached audit for " + chain + ":" + address));
    }
}
