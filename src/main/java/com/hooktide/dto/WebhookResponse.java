package com.hooktide.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * What the VCS provider gets back, and sees in its delivery log.
 *
 * {"status": "dispatched", "deliveryId": "...", "category": "build",
 *  "matchedRule": "github/build/merged-pull-request", "target": "svc-a-build-42", "ack": "run-17"}
 *
 * {"status": "failed", "deliveryId": "...", "stage": "ENRICH", "errorKind": "TIMEOUT", "message": "..."}
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResponse {

    public static final String DISPATCHED = "dispatched";
    public static final String DISCARDED = "discarded";
    public static final String DUPLICATE = "duplicate";
    public static final String FAILED = "failed";

    private String status;
    private String deliveryId;
    private String provider;
    private String category;
    private String matchedRule;
    private String target;
    private String ack;
    private String stage;
    private String errorKind;
    private String message;
}
