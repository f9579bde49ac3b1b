package com.hooktide.model;

import java.time.Instant;

/** Acceptance (not completion) of a dispatch by the execution engine. */
public record DispatchAck(String token, Instant acceptedAt) {
}
