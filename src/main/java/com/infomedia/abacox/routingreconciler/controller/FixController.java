package com.infomedia.abacox.routingreconciler.controller;

import com.infomedia.abacox.routingreconciler.dto.fix.DispFixResult;
import com.infomedia.abacox.routingreconciler.dto.fix.EnpFixResult;
import com.infomedia.abacox.routingreconciler.dto.fix.FixRequest;
import com.infomedia.abacox.routingreconciler.dto.fix.NprnFixResult;
import com.infomedia.abacox.routingreconciler.service.DispFixService;
import com.infomedia.abacox.routingreconciler.service.EnpFixService;
import com.infomedia.abacox.routingreconciler.service.NprnFixService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@Tag(name = "Fix", description = "Number routing reconciliation API")
@SecurityRequirement(name = "Api_Token")
@Log4j2
@RequestMapping("/fix")
public class FixController {

    private final EnpFixService enpFixService;
    private final NprnFixService nprnFixService;
    private final DispFixService dispFixService;

    @PostMapping(value = "/enp", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Reassign numbers to a routing platform",
            description = "Reserves the numbers in the numbers table, clears the outport date and sets the system and NPRN of the selected platform.")
    public EnpFixResult fixEnp(@Valid @RequestBody FixRequest request) {
        log.info("ENP fix requested for '{}' (dryRun={}, target={})", request.getInput(), request.isDryRun(), request.getEnpTarget());
        return enpFixService.fix(request);
    }

    @PostMapping(value = "/nprn", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Invalidate cached routing entries",
            description = "Deletes the nprn:routing keys of the numbers from the routing cache.")
    public NprnFixResult fixNprn(@Valid @RequestBody FixRequest request) {
        log.info("NPRN fix requested for '{}' (dryRun={})", request.getInput(), request.isDryRun());
        return nprnFixService.fix(request);
    }

    @PostMapping(value = "/disp", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Remove dispatcher provisioning rows",
            description = "Deletes the cli_provisioning rows of the numbers and returns the deleted rows.")
    public DispFixResult fixDisp(@Valid @RequestBody FixRequest request) {
        log.info("Dispatcher fix requested for '{}' (dryRun={})", request.getInput(), request.isDryRun());
        return dispFixService.fix(request);
    }
}
