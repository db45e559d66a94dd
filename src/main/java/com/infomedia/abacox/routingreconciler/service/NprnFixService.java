package com.infomedia.abacox.routingreconciler.service;

import com.infomedia.abacox.routingreconciler.component.numbering.NumberPreview;
import com.infomedia.abacox.routingreconciler.component.numbering.PreviewBuilder;
import com.infomedia.abacox.routingreconciler.component.store.RoutingCacheStore;
import com.infomedia.abacox.routingreconciler.dto.fix.FixRequest;
import com.infomedia.abacox.routingreconciler.dto.fix.NprnFixResult;
import com.infomedia.abacox.routingreconciler.dto.fix.PreviewDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Drops cached routing entries so they are rebuilt from the numbers table.
 */
@Service
@RequiredArgsConstructor
@Log4j2
public class NprnFixService {

    private final PreviewBuilder previewBuilder;
    private final RoutingCacheStore routingCacheStore;

    public NprnFixResult fix(FixRequest request) {
        NumberPreview preview = previewBuilder.buildPreview(request.getInput());

        NprnFixResult.NprnFixResultBuilder result = NprnFixResult.builder()
                .dryRun(request.isDryRun())
                .preview(PreviewDto.of(preview))
                .redisDb(routingCacheStore.getDatabase());

        if (request.isDryRun()) {
            log.info("Dry run: {} routing key(s) would be deleted", preview.getCount());
            return result.build();
        }

        List<Long> deletedCounts = routingCacheStore.deleteKeys(preview.getCacheKeys());
        return result.deletedCounts(deletedCounts).build();
    }
}
