package com.sitemapper.core.model;

/** 크롤 종료 판정 방식 */
public enum TerminationMode {
    /** 미처리 작업 카운터가 0이 되는 즉시 종료 (기본) */
    WORK_COUNTER,
    /** 워커 busy/idle 보고 + 디바운스 창 */
    DEBOUNCE
}
