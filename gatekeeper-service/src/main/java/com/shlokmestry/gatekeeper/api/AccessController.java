package com.shlokmestry.gatekeeper.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.shlokmestry.gatekeeper.access.AccessControlService;
import com.shlokmestry.gatekeeper.access.AuthorizationDecision;
import com.shlokmestry.gatekeeper.access.KeyUndeterminedException;
import com.shlokmestry.gatekeeper.config.GatekeeperProperties;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/v1")
public class AccessController {

    private static final Logger log = LoggerFactory.getLogger(AccessController.class);

    private static final long UNDETERMINED_RETRY_AFTER_SECONDS = 1;

    private final AccessControlService access;
    private final GatekeeperProperties props;

    public AccessController(AccessControlService access, GatekeeperProperties props) {
        this.access = access;
        this.props = props;
    }

    @PostMapping("/authorize")
    public ResponseEntity<?> authorize(@Valid @RequestBody AuthorizeRequest req) {
        try {
            return ResponseEntity.ok(access.authorizeRequest(req.token(), req.address()));
        } catch (KeyUndeterminedException e) {
            if (e.banned()) {
                // the ban half is known, only the key half is missing
                log.warn("authorize key_undetermined banned=true address={}", req.address(), e);
                return ResponseEntity.ok(AuthorizationDecision.anonymous(true));
            }
            if (props.isFailOpen()) {
                log.warn("authorize fail_open reason=store_unavailable address={}", req.address(), e);
                return ResponseEntity.ok(AuthorizationDecision.anonymous(false));
            }

            log.warn("authorize fail_closed reason=store_unavailable address={}", req.address(), e);
            HttpHeaders h = new HttpHeaders();
            h.set(HttpHeaders.RETRY_AFTER, String.valueOf(UNDETERMINED_RETRY_AFTER_SECONDS));
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .headers(h)
                    .body(new ErrorBody("undetermined", "Authorization store unavailable"));
        }
    }

    @PostMapping("/usage")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void usage(@Valid @RequestBody RecordUsageRequest req) {
        access.recordUsage(
                req.keyId(),
                req.address(),
                req.endpoint(),
                req.timestamp(),
                req.statusCode(),
                req.elapsedMillis(),
                req.responseBytes()
        );
    }
}
