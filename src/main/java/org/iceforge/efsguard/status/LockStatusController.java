package org.iceforge.efsguard.status;

import org.iceforge.efsguard.lock.LockStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping(path = "/api/lock", produces = MediaType.APPLICATION_JSON_VALUE)
public class LockStatusController {

    private static final Logger log = LoggerFactory.getLogger(LockStatusController.class);

    private final LockStatusService statusService;

    public LockStatusController(LockStatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping
    public LockStatus status() {
        try {
            return statusService.current();
        } catch (LockStoreException e) {
            log.warn("Lock status unavailable: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "lock store unavailable", e);
        }
    }
}
