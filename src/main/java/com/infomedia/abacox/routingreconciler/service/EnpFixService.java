package com.infomedia.abacox.routingreconciler.service;

import com.infomedia.abacox.routingreconciler.component.numbering.NumberPreview;
import com.infomedia.abacox.routingreconciler.component.numbering.PreviewBuilder;
import com.infomedia.abacox.routingreconciler.component.store.NumbersStore;
import com.infomedia.abacox.routingreconciler.dto.fix.EnpFixResult;
import com.infomedia.abacox.routingreconciler.dto.fix.FixRequest;
import com.infomedia.abacox.routingreconciler.dto.fix.PreviewDto;
import com.infomedia.abacox.routingreconciler.model.EnpProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reassigns numbers in the numbers table to a routing platform and clears any
 * pending outport, leaving them reserved.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class EnpFixService {

    private final PreviewBuilder previewBuilder;
    private final NumbersStore numbersStore;

    public EnpFixResult fix(FixRequest request) {
        NumberPreview preview = previewBuilder.buildPreview(request.getInput());
        EnpProfile profile = request.getEnpTarget() == null ? EnpProfile.NXP1 : request.getEnpTarget();

        EnpFixResult.EnpFixResultBuilder result = EnpFixResult.builder()
                .dryRun(request.isDryRun())
                .enpTarget(profile)
                .preview(PreviewDto.of(preview))
                .systemId(profile.getSystemId())
                .nprn(profile.getNprnId());

        if (request.isDryRun()) {
            log.info("Dry run: {} number(s) would be reassigned to {}", preview.getCount(), profile);
            return result.build();
        }

        List<String> updatedDns = numbersStore.reassign(preview.getDns(), profile);
        return result.updatedDns(updatedDns).build();
    }
}
