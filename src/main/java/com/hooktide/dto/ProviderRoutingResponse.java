package com.hooktide.dto;

import com.hooktide.model.Provider;
import com.hooktide.model.SignatureScheme;
import lombok.*;

import java.util.Map;

/** Admin view of one provider's routing. Never includes the secret itself. */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProviderRoutingResponse {
    private Provider provider;
    private boolean enabled;
    private SignatureScheme signatureScheme;
    private boolean commentTrigger;
    private boolean secretConfigured;
    private Map<String, String> variables;
    private Map<String, String> buildRules;
    private Map<String, String> reviewRules;
    private long snapshotVersion;
}
