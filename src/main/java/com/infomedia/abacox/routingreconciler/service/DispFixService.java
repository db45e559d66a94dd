package com.infomedia.abacox.routingreconciler.service;

import com.infomedia.abacox.routingreconciler.component.numbering.NumberPreview;
import com.infomedia.abacox.routingreconciler.component.numbering.PreviewBuilder;
import com.infomedia.abacox.routingreconciler.component.store.ProvisioningCleanup;
import com.infomedia.abacox.routingreconciler.component.store.ProvisioningRow;
import com.infomedia.abacox.routingreconciler.component.store.ProvisioningStore;
import com.infomedia.abacox.routingreconciler.dto.fix.DispFixResult;
import com.infomedia.abacox.routingreconciler.dto.fix.FixRequest;
import com.infomedia.abacox.routingreconciler.dto.fix.PreviewDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Removes stale dispatcher provisioning rows for the given targets.
 * The rows are read before the delete and returned as a snapshot, so the
 * snapshot and the deleted count can differ if the table changes in between.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class DispFixService {

    private final PreviewBuilder previewBuilder;
    private final ProvisioningStore provisioningStore;

    public DispFixResult fix(FixRequest request) {
        NumberPreview preview = previewBuilder.buildPreview(request.getInput());
        PreviewDto previewDto = PreviewDto.of(preview);

        if (request.isDryRun()) {
            List<ProvisioningRow> rows = provisioningStore.findByTargets(preview.getTargets());
            log.info("Dry run: {} provisioning row(s) would be deleted", rows.size());
            return DispFixResult.builder()
                    .dryRun(true)
                    .preview(previewDto)
                    .wouldDeleteCount(rows.size())
                    .wouldDeleteRows(rows)
                    .build();
        }

        ProvisioningCleanup cleanup = provisioningStore.deleteByTargets(preview.getTargets());
        return DispFixResult.builder()
                .dryRun(false)
                .preview(previewDto)
                .deletedCount(cleanup.getDeletedCount())
                .deletedRows(cleanup.getSnapshot())
                .build();
    }
}
