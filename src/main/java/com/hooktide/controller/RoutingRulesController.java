package com.hooktide.controller;

import com.hooktide.dto.FilterRulesRequest;
import com.hooktide.dto.ProviderRoutingResponse;
import com.hooktide.exception.UnknownProviderException;
import com.hooktide.model.Provider;
import com.hooktide.service.RoutingConfigService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/routing")
@RequiredArgsConstructor
public class RoutingRulesController {

    private final RoutingConfigService routingConfigService;

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderRoutingResponse>> listAll() {
        return ResponseEntity.ok(routingConfigService.listAll());
    }

    @GetMapping("/providers/{provider}")
    public ResponseEntity<ProviderRoutingResponse> getByProvider(@PathVariable String provider) {
        return ResponseEntity.ok(routingConfigService.getByProvider(resolve(provider)));
    }

    @PutMapping("/providers/{provider}/filters")
    public ResponseEntity<ProviderRoutingResponse> replaceFilters(
            @PathVariable String provider, @Valid @RequestBody FilterRulesRequest request) {
        return ResponseEntity.ok(routingConfigService.replaceFilters(resolve(provider), request));
    }

    @PostMapping("/reload")
    public ResponseEntity<List<ProviderRoutingResponse>> reload() {
        routingConfigService.reload();
        return ResponseEntity.ok(routingConfigService.listAll());
    }

    private static Provider resolve(String provider) {
        return Provider.fromPathSegment(provider)
                .orElseThrow(() -> new UnknownProviderException("Unknown provider: " + provider));
    }
}
