package com.sitemapper.core.crawler;

/** 시드 URL을 해석할 수 없음. 워커를 띄우기 전에 크롤 전체를 중단한다. */
public class InvalidSeedException extends IllegalArgumentException {
    private final String seed;

    public InvalidSeedException(String seed, String message) {
        super(message);
        this.seed = seed;
    }

    public InvalidSeedException(String seed, String message, Throwable cause) {
        super(message, cause);
        this.seed = seed;
    }

    public String getSeed() { return seed; }
}
