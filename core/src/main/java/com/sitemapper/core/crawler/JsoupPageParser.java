package com.sitemapper.core.crawler;

import com.sitemapper.core.api.IPageParser;
import com.sitemapper.core.model.FetchedPage;
import com.sitemapper.core.model.ParseResult;
import com.sitemapper.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

/**
 * 기본 JSoup 기반 파서
 * - a[href] → 링크
 * - img[src], script[src], link[href] → 정적 리소스(문서 순서 유지)
 * - 문서 host와 다른 URL은 버린다
 */
public class JsoupPageParser implements IPageParser {
    private static final String ASSET_SELECTOR = "img[src], script[src], link[href]";

    private final String defaultScheme;

    public JsoupPageParser() {
        this("http");
    }

    public JsoupPageParser(String defaultScheme) {
        this.defaultScheme = (defaultScheme == null || defaultScheme.isBlank()) ? "http" : defaultScheme;
    }

    @Override
    public ParseResult parse(FetchedPage page) {
        if (page == null || !page.isHtml() || page.getBody().isBlank()) return ParseResult.EMPTY;

        URI base = page.getFinalUri();
        if (base.getRawPath() == null || base.getRawPath().isEmpty()) base = base.resolve("/"); // "http://h" + "a" → "http://ha" 방지
        Document doc = Jsoup.parse(page.getBody(), base.toString());

        List<URI> links = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            URI u = resolve(base, a, "href");
            if (u != null) links.add(UrlUtils.normalize(u));
        }

        List<String> assets = new ArrayList<>();
        for (Element el : doc.select(ASSET_SELECTOR)) {
            URI u = resolve(base, el, "link".equals(el.normalName()) ? "href" : "src");
            if (u != null) assets.add(u.toString());
        }
        return new ParseResult(links, assets);
    }

    /** abs:attr 로 절대화 후 URI 변환, fragment 제거. 같은 host가 아니면 null */
    private URI resolve(URI base, Element el, String attr) {
        String raw = el.attr(attr).trim();
        if (raw.isEmpty() || raw.startsWith("#")) return null;
        String abs = el.attr("abs:" + attr).trim();
        if (abs.isEmpty()) return null; // jsoup이 해석 못한 값
        try {
            URI u = toUri(abs);
            if (u.getScheme() == null) {
                u = toUri(UrlUtils.withDefaultScheme(u.toString(), defaultScheme));
            }
            if (!UrlUtils.isHttpLike(u) || !UrlUtils.sameHost(base, u)) return null;
            String str = u.toString();
            int hash = str.indexOf('#');
            return hash >= 0 ? URI.create(str.substring(0, hash)) : u;
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException ignore) {
            // 인코딩해도 안 되는 URL은 무시
            return null;
        }
    }

    /**
     * 그대로 파싱되면 그대로 쓰고, 공백 등 URI 금지 문자가 있으면
     * 다인자 생성자로 percent-encoding 한다("/about us" → "/about%20us").
     */
    static URI toUri(String abs) throws URISyntaxException, MalformedURLException {
        try {
            return URI.create(abs);
        } catch (IllegalArgumentException e) {
            URL url = new URL(abs);
            return new URI(url.getProtocol(), url.getAuthority(), url.getPath(),
                    url.getQuery(), url.getRef());
        }
    }
}
