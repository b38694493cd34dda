package com.sitemapper.core.service.export;

import com.sitemapper.core.model.CrawlStats;
import com.sitemapper.core.model.Site;

import java.nio.file.Path;

/** 크롤 결과(Site)를 파일로 내보내는 책임 (텍스트/JSON) */
public interface SitemapExporter {
    /**
     * @param baseDir    출력 루트 (null이면 "out")
     * @param site       완료된 사이트맵
     * @param stats      크롤 통계 (null이면 빈 통계)
     * @param startedIso 크롤 시작 시각(ISO-8601)
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, Site site, CrawlStats.Snapshot stats, String startedIso) throws Exception;
}
