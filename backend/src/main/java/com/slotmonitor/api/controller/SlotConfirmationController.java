package com.slotmonitor.api.controller;

import com.slotmonitor.api.dto.ErrorBody;
import com.slotmonitor.confirmation.SlotConfirmationService;
import com.slotmonitor.metrics.SlotMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * GET /isSlotConfirmed/{slot}: 200 if confirmed, 404 if not, 500 if the RPC check failed, 400 for a malformed slot.
 * The lookup may block on RPC, so it runs on the bounded-elastic scheduler.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class SlotConfirmationController {

    private final SlotConfirmationService slotConfirmationService;
    private final SlotMetrics slotMetrics;

    @GetMapping("/isSlotConfirmed/{slot}")
    public Mono<ResponseEntity<?>> isSlotConfirmed(@PathVariable("slot") String slotParam) {
        long slot;
        try {
            slot = Long.parseLong(slotParam);
        } catch (NumberFormatException e) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_SLOT", "slot must be a non-negative integer")));
        }
        if (slot < 0) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_SLOT", "slot must be a non-negative integer")));
        }
        long started = System.nanoTime();
        return Mono.fromCallable(() -> slotConfirmationService.isSlotConfirmed(slot))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(confirmed -> confirmed
                        ? ResponseEntity.ok().build()
                        : ResponseEntity.notFound().build())
                .doFinally(signal -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
                    slotMetrics.recordIsSlotConfirmedElapsed(elapsed);
                    log.debug("Slot {} confirmation check completed in {}ms ({})", slot, elapsed.toMillis(), signal);
                });
    }
}
