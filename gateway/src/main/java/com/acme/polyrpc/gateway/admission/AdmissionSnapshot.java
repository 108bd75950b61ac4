package com.acme.polyrpc.gateway.admission;

public record AdmissionSnapshot(long totalDispatched, int pendingDepth) {}
