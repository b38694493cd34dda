package com.sitemapper.core.model;

/** 워커 상태 보고(전이 시에만 전송). 모니터만 소비한다. */
public record WorkerStatus(int workerId, boolean busy) {

    public static WorkerStatus busy(int workerId) { return new WorkerStatus(workerId, true); }

    public static WorkerStatus idle(int workerId) { return new WorkerStatus(workerId, false); }
}
